package it.gov.pagopa.blob.export.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ExecutionSummary {

  private OffsetDateTime date;
  private String container;
  private String blobPath;

  // local file name -> tokenized URI (null when the upload failed)
  @JsonInclude(JsonInclude.Include.ALWAYS)
  @Builder.Default
  private Map<String, String> uploads = new LinkedHashMap<>();

  @Builder.Default private List<String> complete = new ArrayList<>();

  public long failedUploads() {
    return uploads.values().stream().filter(uri -> uri == null).count();
  }
}
