package it.gov.pagopa.blob.export.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParsedFileName {

  public static final ParsedFileName EMPTY = ParsedFileName.builder().build();

  String directory;
  String fileName;
  String fileExtension;
}
