package it.gov.pagopa.blob.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.microsoft.azure.functions.ExecutionContext;
import com.microsoft.azure.functions.annotation.FunctionName;
import com.microsoft.azure.functions.annotation.TimerTrigger;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.model.ExecutionSummary;
import it.gov.pagopa.blob.export.model.ExportSettings;
import it.gov.pagopa.blob.export.storage.BlobStore;
import it.gov.pagopa.blob.export.util.CommonUtil;
import it.gov.pagopa.blob.export.util.ErrorCodes;
import it.gov.pagopa.blob.export.util.LogSinkConfigurer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;

/**
 * Azure Functions with Timer trigger: uploads the files staged by the upstream export to the
 * export container and marks the run with a {@code .complete} blob.
 */
public class DailyExportFunction {

  public static final String COMPLETE_MARKER = ".complete";

  @Getter private final String connectionString;
  @Getter private final ExportSettings settings;
  private final Clock clock;

  public DailyExportFunction() {
    this(
        CommonUtil.requireEnv(CommonUtil.STORAGE_CONNECTION_STRING),
        settingsFromEnv(),
        Clock.systemUTC());
    try {
      LogSinkConfigurer.installFromEnv();
    } catch (IOException e) {
      throw new ConfigurationException("Unable to open the export log file", e);
    }
  }

  // Constructor to inject settings and clock
  public DailyExportFunction(String connectionString, ExportSettings settings, Clock clock) {
    this.connectionString = connectionString;
    this.settings = settings;
    this.clock = clock;
  }

  static ExportSettings settingsFromEnv() {
    return ExportSettings.builder()
        .container(
            CommonUtil.getEnv("BLOB_STORAGE_EXPORT_CONTAINER", ExportSettings.DEFAULT_CONTAINER))
        .stagingDirectory(Path.of(CommonUtil.requireEnv("EXPORT_STAGING_DIRECTORY")))
        .blobPathPattern(
            CommonUtil.getEnv(
                "EXPORT_BLOB_PATH_PATTERN", ExportSettings.DEFAULT_BLOB_PATH_PATTERN))
        .completeAtRoot(
            CommonUtil.parseBoolean(System.getenv("EXPORT_COMPLETE_AT_ROOT"), true))
        .cleanupStaging(CommonUtil.parseBoolean(System.getenv("EXPORT_CLEANUP_STAGING"), true))
        .retryCount(CommonUtil.parseRetryCount(CommonUtil.getEnv("BLOB_UPLOAD_RETRY_COUNT", "3")))
        .build();
  }

  @FunctionName("DailyExport")
  public void run(
      @TimerTrigger(name = "DailyExportTrigger", schedule = "%EXPORT_SCHEDULE%") String timerInfo,
      final ExecutionContext context) {

    Logger logger = context.getLogger();
    logger.info(
        () ->
            String.format(
                "[EXPORT] Triggered at: %s for container: %s, staging directory: %s",
                LocalDateTime.now(clock)
                    .format(DateTimeFormatter.ofPattern(CommonUtil.LOG_DATETIME_PATTERN)),
                settings.getContainer(),
                settings.getStagingDirectory()));

    try {
      BlobStore store = CommonUtil.createBlobStore(connectionString, logger);
      ExecutionSummary summary = export(store, logger);

      logger.info(() -> "[EXPORT] Execution summary\n" + toJson(summary));
      if (summary.failedUploads() > 0) {
        logger.warning(
            () ->
                String.format(
                    "[EXPORT] %d of %d uploads failed, see the summary",
                    summary.failedUploads(), summary.getUploads().size()));
      }

      if (settings.isCleanupStaging()) {
        deleteRecursively(settings.getStagingDirectory(), logger);
      }

      logger.info(
          () ->
              String.format(
                  "[EXPORT] Execution Finished at: %s for container: %s, blob path: %s",
                  LocalDateTime.now(clock)
                      .format(DateTimeFormatter.ofPattern(CommonUtil.LOG_DATETIME_PATTERN)),
                  settings.getContainer(),
                  summary.getBlobPath()));

    } catch (Exception e) {
      logger.severe(
          () ->
              String.format(
                  "%s container: %s: %s",
                  ErrorCodes.EXPORT_E1.prefix(), settings.getContainer(), e.getMessage()));
    }
  }

  /**
   * Uploads every regular file of the staging directory to {@code <blob path>/<file name>}, then
   * uploads the {@code .complete} marker when at least one file was handled.
   *
   * @return the run summary, with a null URI for every failed upload
   * @throws IOException if the staging directory cannot be read or the marker cannot be written
   */
  public ExecutionSummary export(BlobStore store, Logger logger) throws IOException {
    OffsetDateTime now = OffsetDateTime.now(clock);
    String blobPath = formatBlobPath(settings.getBlobPathPattern(), now);
    String container = settings.getContainer();

    ExecutionSummary summary =
        ExecutionSummary.builder().date(now).container(container).blobPath(blobPath).build();

    Path staging = settings.getStagingDirectory();
    if (staging == null || !Files.isDirectory(staging)) {
      logger.warning(
          () -> String.format("[EXPORT] Staging directory not found: %s, nothing to do", staging));
      return summary;
    }

    for (Path file : stagedFiles(staging)) {
      String fileName = file.getFileName().toString();
      Optional<String> uri =
          store.upload(container, blobPath + fileName, file, settings.getRetryCount());
      summary.getUploads().put(fileName, uri.orElse(null));
    }

    if (!summary.getUploads().isEmpty()) {
      Path marker = staging.resolve(COMPLETE_MARKER);
      Files.writeString(marker, blobPath, StandardCharsets.UTF_8);

      String markerBlob =
          settings.isCompleteAtRoot() ? COMPLETE_MARKER : blobPath + COMPLETE_MARKER;
      logger.info(() -> "[EXPORT] Upload .complete file " + markerBlob);
      if (store.upload(container, markerBlob, marker, settings.getRetryCount()).isPresent()) {
        summary.getComplete().add(markerBlob);
      } else {
        logger.severe(
            () ->
                String.format(
                    "%s %s/%s", ErrorCodes.EXPORT_E3.prefix(), container, markerBlob));
      }
    }

    return summary;
  }

  /**
   * Formats the blob folder for {@code time}, always ending with {@code /}.
   *
   * @throws ConfigurationException if {@code pattern} is not a valid formatter pattern
   */
  static String formatBlobPath(String pattern, OffsetDateTime time) {
    String path;
    try {
      path = DateTimeFormatter.ofPattern(pattern).format(time);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid blob path pattern: " + pattern, e);
    }
    return path.endsWith("/") ? path : path + "/";
  }

  private static List<Path> stagedFiles(Path staging) throws IOException {
    try (Stream<Path> files = Files.list(staging)) {
      return files
          .filter(Files::isRegularFile)
          .filter(file -> !COMPLETE_MARKER.equals(file.getFileName().toString()))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static void deleteRecursively(Path directory, Logger logger) {
    if (directory == null || !Files.exists(directory)) {
      return;
    }
    logger.fine(() -> "[EXPORT] Clean up staging directory " + directory);
    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
        Files.delete(path);
      }
    } catch (IOException e) {
      logger.severe(
          () ->
              String.format(
                  "%s %s: %s", ErrorCodes.EXPORT_E2.prefix(), directory, e.getMessage()));
    }
  }

  private static String toJson(ExecutionSummary summary) {
    try {
      return CommonUtil.createJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(summary);
    } catch (JsonProcessingException e) {
      return summary.toString();
    }
  }
}
