package it.gov.pagopa.blob.export.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.experimental.UtilityClass;

/**
 * Installs a size-bounded, rotating file sink on the root logger. Only the first call per process
 * has an effect.
 */
@UtilityClass
public class LogSinkConfigurer {

  public static final String LOG_FILE = "EXPORT_LOG_FILE";
  public static final String LOG_FILE_LIMIT_BYTES = "EXPORT_LOG_FILE_LIMIT_BYTES";
  public static final String LOG_FILE_COUNT = "EXPORT_LOG_FILE_COUNT";

  public static final int DEFAULT_LIMIT_BYTES = 2 * 1024 * 1024;
  public static final int DEFAULT_FILE_COUNT = 5;

  static final String ROOT_LOGGER = "";

  private final AtomicBoolean installed = new AtomicBoolean(false);

  /** Reads the sink settings from the environment; a no-op when {@code EXPORT_LOG_FILE} is unset. */
  public static boolean installFromEnv() throws IOException {
    String file = System.getenv(LOG_FILE);
    if (file == null || file.isBlank()) {
      return false;
    }
    return install(
        Path.of(file),
        CommonUtil.parsePositiveInt(
            LOG_FILE_LIMIT_BYTES,
            CommonUtil.getEnv(LOG_FILE_LIMIT_BYTES, String.valueOf(DEFAULT_LIMIT_BYTES))),
        CommonUtil.parsePositiveInt(
            LOG_FILE_COUNT,
            CommonUtil.getEnv(LOG_FILE_COUNT, String.valueOf(DEFAULT_FILE_COUNT))));
  }

  /**
   * Opens {@code logFile} as a {@link FileHandler} pattern. With more than one file the handler
   * appends the generation number, e.g. {@code export.log.0}, {@code export.log.1}.
   *
   * @return false if a sink was already installed by an earlier call
   */
  public static boolean install(Path logFile, int limitBytes, int fileCount) throws IOException {
    if (!installed.compareAndSet(false, true)) {
      return false;
    }
    try {
      Path parent = logFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Handler handler = new FileHandler(logFile.toString(), limitBytes, fileCount, true);
      handler.setFormatter(new SimpleFormatter());
      Logger.getLogger(ROOT_LOGGER).addHandler(handler);
      return true;
    } catch (IOException | RuntimeException e) {
      installed.set(false);
      throw e;
    }
  }

  // test hook
  static void reset() {
    Logger logger = Logger.getLogger(ROOT_LOGGER);
    for (Handler handler : logger.getHandlers()) {
      if (handler instanceof FileHandler) {
        logger.removeHandler(handler);
        handler.close();
      }
    }
    installed.set(false);
  }
}
