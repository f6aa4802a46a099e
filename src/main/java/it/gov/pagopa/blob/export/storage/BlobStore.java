package it.gov.pagopa.blob.export.storage;

import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobContainerItem;
import com.azure.storage.blob.models.BlobContainerItemProperties;
import com.azure.storage.blob.models.BlobItem;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.model.AccountCredentials;
import it.gov.pagopa.blob.export.model.ContainerEntry;
import it.gov.pagopa.blob.export.parser.ConnectionStringParser;
import it.gov.pagopa.blob.export.util.CommonUtil;
import it.gov.pagopa.blob.export.util.ErrorCodes;
import it.gov.pagopa.blob.export.wrapper.BlobServiceClientWrapper;
import it.gov.pagopa.blob.export.wrapper.BlobServiceClientWrapperImpl;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Facade over a single storage account.
 *
 * <p>The credentials are parsed once from the connection string; nothing else is cached, every
 * operation resolves its container again. All calls are synchronous and a store instance must not
 * be shared between threads without external synchronization.
 */
public class BlobStore {

  public static final String BLOB_SERVICE_DOMAIN = "blob.core.windows.net";
  public static final int DEFAULT_RETRY_COUNT = 3;

  private final String connectionString;
  @Getter private final AccountCredentials credentials;
  private final BlobServiceClientWrapper blobServiceClientWrapper;
  private final SasTokenIssuer sasTokenIssuer;
  private final Logger logger;

  public BlobStore(String connectionString, Logger logger) {
    this(connectionString, new BlobServiceClientWrapperImpl(), Clock.systemUTC(), logger);
  }

  public BlobStore(
      String connectionString,
      BlobServiceClientWrapper blobServiceClientWrapper,
      Clock clock,
      Logger logger) {
    this.connectionString = connectionString;
    this.credentials = ConnectionStringParser.parse(connectionString);
    this.blobServiceClientWrapper = blobServiceClientWrapper;
    this.sasTokenIssuer = new SasTokenIssuer(clock);
    this.logger = logger != null ? logger : Logger.getLogger(BlobStore.class.getName());
  }

  public static String serviceEndpoint(String accountName) {
    return String.format("https://%s.%s", accountName, BLOB_SERVICE_DOMAIN);
  }

  /** Names of all the containers of the account. */
  public List<String> listContainers() {
    long start = System.nanoTime();
    List<String> names =
        serviceClient().listBlobContainers().stream()
            .map(BlobContainerItem::getName)
            .collect(Collectors.toList());
    trace("listContainers", "", names, start);
    return names;
  }

  /** Containers with their public access level, null when the container is private. */
  public List<ContainerEntry> listContainersWithAccess() {
    long start = System.nanoTime();
    List<ContainerEntry> entries =
        serviceClient().listBlobContainers().stream()
            .map(item -> new ContainerEntry(item.getName(), publicAccessOf(item)))
            .collect(Collectors.toList());
    trace("listContainersWithAccess", "", entries, start);
    return entries;
  }

  /** Blob names in {@code containerName}; the container is created when missing. */
  public List<String> listBlobs(String containerName) {
    long start = System.nanoTime();
    List<String> names = blobNames(createContainer(containerName));
    trace("listBlobs", containerName, names, start);
    return names;
  }

  /**
   * Returns a client for {@code containerName}, creating the container only when the account does
   * not list it already.
   */
  public BlobContainerClient createContainer(String containerName) {
    long start = System.nanoTime();
    BlobServiceClient serviceClient = serviceClient();
    boolean exists =
        serviceClient.listBlobContainers().stream()
            .anyMatch(item -> containerName.equals(item.getName()));
    if (!exists) {
      serviceClient.createBlobContainer(containerName);
      logger.info(() -> String.format("Container created: %s", containerName));
    }
    BlobContainerClient containerClient = serviceClient.getBlobContainerClient(containerName);
    trace("createContainer", containerName, exists ? "existing" : "created", start);
    return containerClient;
  }

  public Optional<String> upload(String containerName, String blobPath, Path localFile) {
    return upload(containerName, blobPath, localFile, DEFAULT_RETRY_COUNT);
  }

  /**
   * Variant for retry counts read from configuration.
   *
   * @throws ConfigurationException if {@code retryCount} is not a positive integer
   */
  public Optional<String> upload(
      String containerName, String blobPath, Path localFile, String retryCount) {
    return upload(containerName, blobPath, localFile, CommonUtil.parseRetryCount(retryCount));
  }

  /**
   * Uploads {@code localFile} to {@code containerName/blobPath}, replacing any blob already stored
   * there.
   *
   * <p>Every attempt resolves the container, reopens the file, deletes the existing blob, uploads
   * and signs a read token. Failures are logged and the next attempt starts immediately; after
   * {@code retryCount} failed attempts the result is empty.
   *
   * @return the blob URI with its SAS token, or empty when no attempt succeeded
   * @throws ConfigurationException if {@code retryCount} is lower than 1
   */
  public Optional<String> upload(
      String containerName, String blobPath, Path localFile, int retryCount) {
    if (retryCount < 1) {
      throw new ConfigurationException("Upload retry count must be at least 1, got: " + retryCount);
    }
    long start = System.nanoTime();
    String args = String.format("%s, %s, %s, %d", containerName, blobPath, localFile, retryCount);

    String uri = null;
    for (int attempt = 1; uri == null && attempt <= retryCount; attempt++) {
      try {
        uri = uploadAttempt(containerName, blobPath, localFile);
        logger.info(() -> String.format("Blob uploaded: %s/%s", containerName, blobPath));
      } catch (Exception e) {
        final int failed = attempt;
        logger.warning(
            () ->
                String.format(
                    "%s Attempt %d/%d for %s/%s: %s",
                    ErrorCodes.BLOB_E1.prefix(),
                    failed,
                    retryCount,
                    containerName,
                    blobPath,
                    e.getMessage()));
      }
    }

    if (uri == null) {
      logger.severe(
          () ->
              String.format(
                  "%s %s/%s from %s after %d attempts",
                  ErrorCodes.BLOB_E3.prefix(), containerName, blobPath, localFile, retryCount));
    }
    trace("upload", args, uri, start);
    return Optional.ofNullable(uri);
  }

  private String uploadAttempt(String containerName, String blobPath, Path localFile)
      throws IOException {
    BlobContainerClient containerClient = createContainer(containerName);
    try (InputStream stream = Files.newInputStream(localFile)) {
      BlobClient blobClient = containerClient.getBlobClient(blobPath);

      // overwrite: drop the previous blob before uploading the new content
      if (blobNames(containerClient).contains(blobPath)) {
        blobClient.delete();
      }
      blobClient.upload(stream, Files.size(localFile));

      String sasToken = generateSasTokenForBlob(containerName, blobPath);
      return generateUri(containerName, blobPath, sasToken);
    }
  }

  /**
   * Downloads a blob into {@code localDirectory}, keeping only the last segment of {@code blobPath}
   * as file name. The directory is created when missing and an existing target file is deleted
   * first. A {@code blobPath} without a file name segment downloads nothing.
   *
   * @return true when the blob was listed in the container and written to disk
   */
  public boolean download(String containerName, String blobPath, Path localDirectory) {
    long start = System.nanoTime();
    String args = String.format("%s, %s, %s", containerName, blobPath, localDirectory);
    boolean downloaded = false;
    Path target = null;
    try {
      Files.createDirectories(localDirectory);
      String fileName = localFileName(blobPath);
      if (fileName.isEmpty()) {
        logger.info(
            () -> String.format("No file name in blob path: %s/%s", containerName, blobPath));
        trace("download", args, false, start);
        return false;
      }
      target = localDirectory.resolve(fileName);
      Files.deleteIfExists(target);

      BlobContainerClient containerClient = createContainer(containerName);
      if (blobNames(containerClient).contains(blobPath)) {
        try (OutputStream out = Files.newOutputStream(target)) {
          containerClient.getBlobClient(blobPath).downloadStream(out);
        }
        downloaded = Files.exists(target);
      } else {
        logger.info(() -> String.format("Blob not found: %s/%s", containerName, blobPath));
      }
    } catch (Exception e) {
      logger.severe(
          () ->
              String.format(
                  "%s %s/%s: %s",
                  ErrorCodes.BLOB_E2.prefix(), containerName, blobPath, e.getMessage()));
      deletePartial(target);
    }
    trace("download", args, downloaded, start);
    return downloaded;
  }

  public String generateSasTokenForBlob(String containerName, String blobPath) {
    return generateSasTokenForBlob(containerName, blobPath, SasTokenIssuer.DEFAULT_VALIDITY);
  }

  public String generateSasTokenForBlob(String containerName, String blobPath, Duration validFor) {
    return sasTokenIssuer.issueForBlob(credentials, containerName, blobPath, validFor);
  }

  public String generateSasTokenForContainer(String containerName) {
    return generateSasTokenForContainer(containerName, SasTokenIssuer.DEFAULT_VALIDITY);
  }

  public String generateSasTokenForContainer(String containerName, Duration validFor) {
    return sasTokenIssuer.issueForContainer(credentials, containerName, validFor);
  }

  /** {@code https://{account}.blob.core.windows.net/{container}/{blobPath}{sasToken}} */
  public String generateUri(String containerName, String blobPath, String sasToken) {
    return String.format(
        "%s/%s/%s%s",
        serviceEndpoint(credentials.getAccountName()),
        containerName,
        blobPath,
        sasToken == null ? "" : sasToken);
  }

  static String localFileName(String blobPath) {
    if (blobPath.indexOf('/') >= 0) {
      return blobPath.substring(blobPath.lastIndexOf('/') + 1);
    }
    if (blobPath.indexOf('\\') >= 0) {
      return blobPath.substring(blobPath.lastIndexOf('\\') + 1);
    }
    return blobPath;
  }

  private BlobServiceClient serviceClient() {
    return blobServiceClientWrapper.getBlobServiceClient(connectionString);
  }

  private static List<String> blobNames(BlobContainerClient containerClient) {
    return containerClient.listBlobs().stream()
        .map(BlobItem::getName)
        .collect(Collectors.toList());
  }

  private static String publicAccessOf(BlobContainerItem item) {
    BlobContainerItemProperties properties = item.getProperties();
    if (properties == null || properties.getPublicAccess() == null) {
      return null;
    }
    return properties.getPublicAccess().toString();
  }

  private void deletePartial(Path target) {
    if (target == null) {
      return;
    }
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      logger.warning(() -> String.format("Unable to remove %s: %s", target, e.getMessage()));
    }
  }

  // operation boundary log: arguments, result and elapsed time
  private void trace(String operation, String args, Object result, long startNanos) {
    long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    logger.fine(
        () ->
            String.format(
                "BlobStore.%s(%s) returned %s in %d ms", operation, args, result, elapsedMs));
  }
}
