package com.oplogtail.tail;

import static org.assertj.core.api.Assertions.assertThat;

import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.model.Operation;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchWindowTest {

  private final AtomicLong clock = new AtomicLong();

  private static Operation op(int id) {
    return Operation.directRead(Namespace.parse("shop.orders"), new Document("_id", id));
  }

  @Test
  @DisplayName("add() should report full at the size bound")
  void fullAtMaxSize() {
    BatchWindow window = new BatchWindow(3, Duration.ofSeconds(1), clock::get);

    assertThat(window.add(op(1))).isFalse();
    assertThat(window.add(op(2))).isFalse();
    assertThat(window.add(op(3))).isTrue();
    assertThat(window.drain()).hasSize(3);
    assertThat(window.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("the latency bound should run from the first operation")
  void latencyFromFirstOperation() {
    BatchWindow window = new BatchWindow(50, Duration.ofMillis(750), clock::get);
    clock.set(Duration.ofSeconds(10).toNanos());
    window.add(op(1));

    clock.addAndGet(Duration.ofMillis(500).toNanos());
    window.add(op(2));
    assertThat(window.isExpired()).isFalse();
    assertThat(window.remainingNanos()).isEqualTo(Duration.ofMillis(250).toNanos());

    clock.addAndGet(Duration.ofMillis(250).toNanos());
    assertThat(window.isExpired()).isTrue();
  }

  @Test
  @DisplayName("an empty window never expires")
  void emptyNeverExpires() {
    BatchWindow window = new BatchWindow(50, Duration.ofMillis(1), clock::get);
    clock.set(Long.MAX_VALUE / 2);

    assertThat(window.isExpired()).isFalse();
  }
}
