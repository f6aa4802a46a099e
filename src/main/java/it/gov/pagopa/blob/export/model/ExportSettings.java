package it.gov.pagopa.blob.export.model;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/** Settings of the daily export, read from the Function App configuration. */
@Value
@Builder(toBuilder = true)
public class ExportSettings {

  public static final String DEFAULT_CONTAINER = "daily-exports";
  public static final String DEFAULT_BLOB_PATH_PATTERN = "'daily/'yyyy/MM/dd";

  @Builder.Default String container = DEFAULT_CONTAINER;
  Path stagingDirectory;
  // java.time.format.DateTimeFormatter pattern of the blob folder
  @Builder.Default String blobPathPattern = DEFAULT_BLOB_PATH_PATTERN;
  @Builder.Default boolean completeAtRoot = true;
  @Builder.Default boolean cleanupStaging = true;
  @Builder.Default int retryCount = 3;
}
