package com.oplogtail.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TailEventTest {

  @Test
  @DisplayName("from() should flatten a log operation")
  void fromLogOperation() {
    Operation op =
        Operation.builder()
            .kind(OperationKind.INSERT)
            .namespace(Namespace.parse("shop.orders"))
            .documentId("o-1")
            .body(new Document("_id", "o-1").append("total", 12))
            .position(LogPosition.of(10, 2))
            .build();

    TailEvent event = TailEvent.from(op);

    assertThat(event.getOperation()).isEqualTo("insert");
    assertThat(event.getNamespace()).isEqualTo("shop.orders");
    assertThat(event.getDocumentId()).isEqualTo("o-1");
    assertThat(event.getPayloadJson()).contains("\"total\": 12");
    assertThat(event.getPosition()).isEqualTo(LogPosition.of(10, 2).toHexString());
    assertThat(event.getProvenance()).isEqualTo("LOG");
  }

  @Test
  @DisplayName("from() should leave the position empty for direct reads")
  void fromDirectRead() {
    TailEvent event =
        TailEvent.from(Operation.directRead(Namespace.parse("shop.orders"), new Document("_id", 1)));

    assertThat(event.getPosition()).isNull();
    assertThat(event.getProvenance()).isEqualTo("DIRECT_READ");
  }

  @Test
  @DisplayName("toJson() and fromJson() should preserve every field")
  void json() {
    TailEvent event =
        TailEvent.from(
            Operation.builder()
                .kind(OperationKind.DELETE)
                .namespace(Namespace.parse("shop.orders"))
                .documentId(3)
                .position(LogPosition.of(10, 3))
                .build());

    TailEvent restored = TailEvent.fromJson(event.toJson());

    assertThat(restored).isEqualTo(event);
  }

  @Test
  @DisplayName("from() should reject null")
  void rejectsNull() {
    assertThatThrownBy(() -> TailEvent.from(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
