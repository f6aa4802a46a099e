package it.gov.pagopa.blob.export.storage;

import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.sas.BlobContainerSasPermission;
import com.azure.storage.blob.sas.BlobSasPermission;
import com.azure.storage.blob.sas.BlobServiceSasSignatureValues;
import com.azure.storage.common.StorageSharedKeyCredential;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.exception.CredentialException;
import it.gov.pagopa.blob.export.model.AccountCredentials;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Issues service SAS tokens signed with the account shared key.
 *
 * <p>Tokens are computed locally from the credentials, no request reaches the storage account.
 * Blob tokens are read only, container tokens carry read/add/create/write/delete. The returned
 * string starts with {@code ?} so it can be appended to a blob URI as is.
 */
public class SasTokenIssuer {

  public static final Duration DEFAULT_VALIDITY = Duration.ofDays(7);
  public static final String BLOB_PERMISSIONS = "r";
  public static final String CONTAINER_PERMISSIONS = "racwd";

  private final Clock clock;

  public SasTokenIssuer() {
    this(Clock.systemUTC());
  }

  public SasTokenIssuer(Clock clock) {
    this.clock = clock;
  }

  public String issueForBlob(AccountCredentials credentials, String container, String blobPath) {
    return issueForBlob(credentials, container, blobPath, DEFAULT_VALIDITY);
  }

  public String issueForBlob(
      AccountCredentials credentials, String container, String blobPath, Duration validFor) {
    BlobServiceSasSignatureValues values =
        signatureValues(validFor, BlobSasPermission.parse(BLOB_PERMISSIONS));
    return "?"
        + containerClient(credentials, container).getBlobClient(blobPath).generateSas(values);
  }

  public String issueForContainer(AccountCredentials credentials, String container) {
    return issueForContainer(credentials, container, DEFAULT_VALIDITY);
  }

  public String issueForContainer(
      AccountCredentials credentials, String container, Duration validFor) {
    BlobServiceSasSignatureValues values =
        signatureValues(validFor, BlobContainerSasPermission.parse(CONTAINER_PERMISSIONS));
    return "?" + containerClient(credentials, container).generateSas(values);
  }

  private BlobServiceSasSignatureValues signatureValues(
      Duration validFor, BlobSasPermission permission) {
    OffsetDateTime start = start(validFor);
    return new BlobServiceSasSignatureValues(start.plus(validFor), permission)
        .setStartTime(start);
  }

  private BlobServiceSasSignatureValues signatureValues(
      Duration validFor, BlobContainerSasPermission permission) {
    OffsetDateTime start = start(validFor);
    return new BlobServiceSasSignatureValues(start.plus(validFor), permission)
        .setStartTime(start);
  }

  private OffsetDateTime start(Duration validFor) {
    if (validFor == null || validFor.isNegative() || validFor.isZero()) {
      throw new ConfigurationException("SAS token validity must be positive, got: " + validFor);
    }
    return OffsetDateTime.now(clock);
  }

  // Offline client: only used to sign with the shared key credential.
  private static BlobContainerClient containerClient(
      AccountCredentials credentials, String container) {
    if (credentials == null || !credentials.isComplete()) {
      throw new CredentialException(
          "Account name and account key are required to generate a SAS token");
    }
    return new BlobServiceClientBuilder()
        .endpoint(BlobStore.serviceEndpoint(credentials.getAccountName()))
        .credential(
            new StorageSharedKeyCredential(
                credentials.getAccountName(), credentials.getAccountKey()))
        .buildClient()
        .getBlobContainerClient(container);
  }
}
