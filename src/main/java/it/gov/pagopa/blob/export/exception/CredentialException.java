package it.gov.pagopa.blob.export.exception;

/** Raised when a SAS token is requested but the account name or key is missing. */
public class CredentialException extends RuntimeException {

  private static final long serialVersionUID = -3514409163946187062L;

  public CredentialException(String message) {
    super(message);
  }

  public CredentialException(String message, Throwable cause) {
    super(message, cause);
  }
}
