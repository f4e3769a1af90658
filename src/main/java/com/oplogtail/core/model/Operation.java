package com.oplogtail.core.model;

import lombok.Builder;
import lombok.Value;
import org.bson.Document;

/**
 * One semantic change-log entry.
 *
 * <p>{@code partial} marks a body that is a delta or absent; such operations need the current
 * document fetched before dispatch. Log-origin operations carry a sequence number assigned at
 * ingestion; direct-read operations carry {@link #NO_SEQUENCE} and no position.
 */
@Value
@Builder(toBuilder = true)
public class Operation {

  public static final long NO_SEQUENCE = -1L;

  OperationKind kind;
  Namespace namespace;
  Object documentId;
  Document body;
  boolean partial;
  LogPosition position;
  @Builder.Default Provenance provenance = Provenance.LOG;
  @Builder.Default long sequence = NO_SEQUENCE;

  public static Operation directRead(Namespace namespace, Document document) {
    return Operation.builder()
        .kind(OperationKind.INSERT)
        .namespace(namespace)
        .documentId(document.get("_id"))
        .body(document)
        .provenance(Provenance.DIRECT_READ)
        .build();
  }

  public boolean isFromLog() {
    return provenance == Provenance.LOG;
  }

  public boolean isDirectRead() {
    return provenance == Provenance.DIRECT_READ;
  }

  public boolean isInsert() {
    return kind == OperationKind.INSERT;
  }

  public boolean isUpdate() {
    return kind == OperationKind.UPDATE;
  }

  public boolean isDelete() {
    return kind == OperationKind.DELETE;
  }

  public boolean isDrop() {
    return kind == OperationKind.DROP;
  }

  /** Copy carrying a complete document body. */
  public Operation withBody(Document fullDocument) {
    return toBuilder().body(fullDocument).partial(false).build();
  }

  public Operation withSequence(long sequence) {
    return toBuilder().sequence(sequence).build();
  }

  @Override
  public String toString() {
    return kind + " " + namespace + " id=" + documentId + " " + provenance
        + (position != null ? " " + position : "")
        + (sequence != NO_SEQUENCE ? " seq=" + sequence : "");
  }
}
