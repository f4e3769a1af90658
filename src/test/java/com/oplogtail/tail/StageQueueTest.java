package com.oplogtail.tail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StageQueueTest {

  @Test
  @DisplayName("should end only after every producer closed")
  void endsAfterAllProducers() throws Exception {
    StageQueue<String> queue = new StageQueue<>("test", 10, 2);
    queue.put("a");
    queue.close();
    queue.put("b");
    queue.close();

    assertThat(queue.take()).isEqualTo("a");
    assertThat(queue.take()).isEqualTo("b");
    assertThat(queue.take()).isNull();
    assertThat(queue.isEnded()).isTrue();
  }

  @Test
  @DisplayName("every consumer should see the end")
  void endVisibleToAllConsumers() throws Exception {
    StageQueue<String> queue = new StageQueue<>("test", 10, 1);
    queue.close();

    assertThat(queue.take()).isNull();
    assertThat(queue.take()).isNull();
    assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isNull();
  }

  @Test
  @DisplayName("poll() should time out without ending")
  void pollTimeout() throws Exception {
    StageQueue<String> queue = new StageQueue<>("test", 10, 1);

    assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isNull();
    assertThat(queue.isEnded()).isFalse();
  }

  @Test
  @DisplayName("put() should block while the queue is full")
  void putBlocksWhenFull() throws Exception {
    StageQueue<Integer> queue = new StageQueue<>("test", 1, 1);
    AtomicBoolean secondPut = new AtomicBoolean();
    List<Integer> taken = new CopyOnWriteArrayList<>();
    queue.put(1);

    Thread producer =
        new Thread(
            () -> {
              try {
                queue.put(2);
                secondPut.set(true);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    producer.start();

    Thread.sleep(100);
    assertThat(secondPut).isFalse();

    taken.add(queue.take());
    await().atMost(Duration.ofSeconds(5)).untilTrue(secondPut);
    taken.add(queue.take());
    assertThat(taken).containsExactly(1, 2);
  }
}
