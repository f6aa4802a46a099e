package it.gov.pagopa.blob.export.util;

import lombok.Getter;

@Getter
public enum ErrorCodes {
  // Storage errors
  BLOB_E1("BLOB-E1", "Error while uploading blob."),
  BLOB_E2("BLOB-E2", "Error while downloading blob."),
  BLOB_E3("BLOB-E3", "Upload retries exhausted."),
  // Export errors
  EXPORT_E1("EXPORT-E1", "Error while running the daily export."),
  EXPORT_E2("EXPORT-E2", "Error while cleaning up the staging directory."),
  EXPORT_E3("EXPORT-E3", "Completion marker not uploaded."),
  // HTTP errors
  HTTP_E1("HTTP-E1", "Error while serving a blob request.");

  private final String code;
  private final String message;

  ErrorCodes(String code, String message) {
    this.code = code;
    this.message = message;
  }

  /** Prefix for severe log lines, e.g. {@code [BLOB-E1] Error while uploading blob.} */
  public String prefix() {
    return String.format("[%s] %s", code, message);
  }
}
