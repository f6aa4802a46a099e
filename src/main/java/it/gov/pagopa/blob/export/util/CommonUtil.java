package it.gov.pagopa.blob.export.util;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.storage.BlobStore;
import it.gov.pagopa.blob.export.wrapper.BlobServiceClientWrapper;
import it.gov.pagopa.blob.export.wrapper.BlobServiceClientWrapperImpl;
import java.time.Clock;
import java.util.logging.Logger;
import lombok.Setter;
import lombok.experimental.UtilityClass;

@UtilityClass
public class CommonUtil {

  public static final String LOG_DATETIME_PATTERN = "yyyy-MM-dd HH:mm:ss";

  public static final String STORAGE_CONNECTION_STRING = "BLOB_STORAGE_CONNECTION_STRING";

  @Setter
  private BlobServiceClientWrapper blobServiceClientWrapper = new BlobServiceClientWrapperImpl();

  /** One store per invocation, logging through the invocation logger. */
  public static BlobStore createBlobStore(String connectionString, Logger logger) {
    return new BlobStore(connectionString, blobServiceClientWrapper, Clock.systemUTC(), logger);
  }

  public static JsonMapper createJsonMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .build();
  }

  /**
   * Reads a mandatory setting.
   *
   * @throws ConfigurationException if the variable is unset or blank
   */
  public static String requireEnv(String name) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException("Missing required setting: " + name);
    }
    return value;
  }

  public static String getEnv(String name, String defaultValue) {
    return System.getenv().getOrDefault(name, defaultValue);
  }

  /**
   * Coerces an upload retry count read from configuration.
   *
   * @throws ConfigurationException if the value is not a positive integer
   */
  public static int parseRetryCount(String value) {
    return parsePositiveInt("upload retry count", value);
  }

  public static int parsePositiveInt(String setting, String value) {
    int parsed;
    try {
      parsed = Integer.parseInt(value == null ? "" : value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          String.format("Invalid %s '%s': not a number", setting, value), e);
    }
    if (parsed < 1) {
      throw new ConfigurationException(
          String.format("Invalid %s '%s': must be at least 1", setting, value));
    }
    return parsed;
  }

  public static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
