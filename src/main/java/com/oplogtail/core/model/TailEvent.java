package com.oplogtail.core.model;

import com.oplogtail.core.util.JsonUtils;
import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Flattened, JSON-friendly view of a dispatched {@link Operation}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TailEvent implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  private String operation;
  private String namespace;
  private String documentId;
  private String payloadJson;
  private String position;
  private String provenance;
  private Instant processedTime;

  public static TailEvent from(Operation op) {
    if (op == null) {
      throw new IllegalArgumentException("operation must not be null");
    }
    return TailEvent.builder()
        .operation(op.getKind().name().toLowerCase())
        .namespace(String.valueOf(op.getNamespace()))
        .documentId(op.getDocumentId() != null ? String.valueOf(op.getDocumentId()) : null)
        .payloadJson(op.getBody() != null ? op.getBody().toJson() : null)
        .position(op.getPosition() != null ? op.getPosition().toHexString() : null)
        .provenance(op.getProvenance().name())
        .processedTime(Instant.now())
        .build();
  }

  public static TailEvent fromJson(String json) {
    return JsonUtils.fromJson(json, TailEvent.class);
  }

  public String toJson() {
    return JsonUtils.toJson(this);
  }
}
