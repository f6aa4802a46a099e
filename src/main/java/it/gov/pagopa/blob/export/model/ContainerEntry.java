package it.gov.pagopa.blob.export.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ContainerEntry {

  String name;
  /** Null for private containers, otherwise {@code blob} or {@code container}. */
  String publicAccess;
}
