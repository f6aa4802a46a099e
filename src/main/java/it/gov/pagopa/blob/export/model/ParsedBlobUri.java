package it.gov.pagopa.blob.export.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedBlobUri {

  /** Result for anything that is not a blob URI. */
  public static final ParsedBlobUri EMPTY = ParsedBlobUri.builder().build();

  String account;
  String container;
  String blobPath;
  String fileName;
  String fileExtension;
  String sasToken;

  @JsonIgnore
  public boolean isEmpty() {
    return account == null
        && container == null
        && blobPath == null
        && fileName == null
        && fileExtension == null
        && sasToken == null;
  }
}
