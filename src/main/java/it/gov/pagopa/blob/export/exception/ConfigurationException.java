package it.gov.pagopa.blob.export.exception;

public class ConfigurationException extends RuntimeException {

  private static final long serialVersionUID = 7823190472561104559L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
