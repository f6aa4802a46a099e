package it.gov.pagopa.blob.export.wrapper;

import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;

public class BlobServiceClientWrapperImpl implements BlobServiceClientWrapper {
  @Override
  public BlobServiceClient getBlobServiceClient(String connectionString) {
    return new BlobServiceClientBuilder().connectionString(connectionString).buildClient();
  }
}
