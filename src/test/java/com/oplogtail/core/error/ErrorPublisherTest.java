package com.oplogtail.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.TailError;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ErrorPublisherTest {

  private final Metrics metrics = new Metrics(null, "test", "ErrorPublisher");

  private static TailError error(String message) {
    return TailError.of(ErrorType.TRANSIENT, "test", message, null);
  }

  @Test
  @DisplayName("should deliver errors in publication order")
  void deliversInOrder() {
    List<String> received = new CopyOnWriteArrayList<>();
    ErrorPublisher publisher = new ErrorPublisher(e -> received.add(e.getErrorMessage()), metrics, "errors");
    publisher.start();

    publisher.publish(error("a"));
    publisher.publish(error("b"));
    publisher.publish(error("c"));

    await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 3);
    assertThat(received).containsExactly("a", "b", "c");
    publisher.close();
  }

  @Test
  @DisplayName("publish() should not block while the handler is stuck")
  void publishNeverBlocks() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    ErrorPublisher publisher =
        new ErrorPublisher(
            e -> {
              try {
                release.await();
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
              }
            },
            metrics,
            "errors");
    publisher.start();

    long started = System.nanoTime();
    for (int i = 0; i < 1_000; i++) {
      publisher.publish(error("e" + i));
    }

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(2_000);
    release.countDown();
    publisher.close();
    assertThat(metrics.count(MetricKeys.ERROR_PUBLISHED_COUNT)).isEqualTo(1_000d);
  }

  @Test
  @DisplayName("close() should flush pending errors and count later ones as failed")
  void closeFlushes() {
    List<String> received = new CopyOnWriteArrayList<>();
    ErrorPublisher publisher = new ErrorPublisher(e -> received.add(e.getErrorMessage()), metrics, "errors");
    publisher.start();
    publisher.publish(error("before"));

    publisher.close();
    publisher.publish(error("after"));

    assertThat(received).containsExactly("before");
    assertThat(metrics.count(MetricKeys.ERROR_FAILED_COUNT)).isEqualTo(1d);
  }

  @Test
  @DisplayName("a failing handler should not stop later deliveries")
  void handlerFailureIsContained() {
    List<String> received = new CopyOnWriteArrayList<>();
    ErrorPublisher publisher =
        new ErrorPublisher(
            e -> {
              if (e.getErrorMessage().equals("bad")) {
                throw new IllegalStateException("handler broke");
              }
              received.add(e.getErrorMessage());
            },
            metrics,
            "errors");
    publisher.start();

    publisher.publish(error("bad"));
    publisher.publish(error("good"));
    publisher.close();

    assertThat(received).containsExactly("good");
    assertThat(metrics.count(MetricKeys.ERROR_FAILED_COUNT)).isEqualTo(1d);
  }
}
