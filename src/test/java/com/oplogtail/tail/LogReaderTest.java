package com.oplogtail.tail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.OperationKind;
import com.oplogtail.core.model.TailError;
import com.oplogtail.core.store.FakeOplogStore;
import com.oplogtail.core.store.LogHistoryLostException;
import com.oplogtail.core.store.RawLogEntry;
import com.oplogtail.tail.position.InMemoryPositionStore;
import com.oplogtail.tail.position.PositionTracker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LogReaderTest {

  private static final LogPosition TS = LogPosition.of(100, 1);

  private static RawLogEntry entry(String op, String ns, Document o, Document o2) {
    return RawLogEntry.builder().position(TS).op(op).ns(ns).object(o).object2(o2).build();
  }

  @Nested
  @DisplayName("normalize()")
  class Normalize {

    @Test
    @DisplayName("should map an insert with its full body")
    void insert() {
      Operation op = LogReader.normalize(entry("i", "shop.orders", new Document("_id", 1).append("a", 1), null)).orElseThrow();

      assertThat(op.getKind()).isEqualTo(OperationKind.INSERT);
      assertThat(op.getDocumentId()).isEqualTo(1);
      assertThat(op.isPartial()).isFalse();
      assertThat(op.getPosition()).isEqualTo(TS);
    }

    @Test
    @DisplayName("should mark an operator update as partial and take the id from o2")
    void deltaUpdate() {
      Operation op =
          LogReader.normalize(
                  entry("u", "shop.orders", new Document("$set", new Document("a", 2)), new Document("_id", 1)))
              .orElseThrow();

      assertThat(op.getKind()).isEqualTo(OperationKind.UPDATE);
      assertThat(op.getDocumentId()).isEqualTo(1);
      assertThat(op.isPartial()).isTrue();
    }

    @Test
    @DisplayName("should treat a replacement update as complete")
    void replacementUpdate() {
      Operation op =
          LogReader.normalize(entry("u", "shop.orders", new Document("_id", 1).append("a", 3), new Document("_id", 1)))
              .orElseThrow();

      assertThat(op.isPartial()).isFalse();
    }

    @Test
    @DisplayName("should map a delete to its id")
    void delete() {
      Operation op = LogReader.normalize(entry("d", "shop.orders", new Document("_id", 9), null)).orElseThrow();

      assertThat(op.getKind()).isEqualTo(OperationKind.DELETE);
      assertThat(op.getDocumentId()).isEqualTo(9);
    }

    @Test
    @DisplayName("should map drop and dropDatabase commands")
    void drops() {
      Operation drop = LogReader.normalize(entry("c", "shop.$cmd", new Document("drop", "orders"), null)).orElseThrow();
      Operation dropDb =
          LogReader.normalize(entry("c", "shop.$cmd", new Document("dropDatabase", 1), null)).orElseThrow();

      assertThat(drop.getKind()).isEqualTo(OperationKind.DROP);
      assertThat(drop.getNamespace()).isEqualTo(Namespace.parse("shop.orders"));
      assertThat(dropDb.getNamespace()).isEqualTo(Namespace.database("shop"));
    }

    @Test
    @DisplayName("should skip no-ops, other commands, system collections and bad namespaces")
    void skips() {
      assertThat(LogReader.normalize(entry("n", "", new Document("msg", "noop"), null))).isEmpty();
      assertThat(LogReader.normalize(entry("c", "shop.$cmd", new Document("create", "orders"), null))).isEmpty();
      assertThat(LogReader.normalize(entry("i", "shop.system.indexes", new Document("_id", 1), null))).isEmpty();
      assertThat(LogReader.normalize(entry("i", "shop", new Document("_id", 1), null))).isEmpty();
    }
  }

  @Nested
  @DisplayName("reading")
  class Reading {

    private final FakeOplogStore store = new FakeOplogStore();
    private final ErrorPublisher errors = mock(ErrorPublisher.class);
    private final StageQueue<Operation> ingest = new StageQueue<>("ingest", 100, 1);
    private final AtomicBoolean fatal = new AtomicBoolean();
    private final Metrics metrics = new Metrics(null, "test", "LogReader");
    private PositionTracker tracker;
    private LogReader reader;
    private Thread thread;

    private LogReader start(LogPosition resume) throws Exception {
      return start(resume, 100);
    }

    private LogReader start(LogPosition resume, int maxInFlight) throws Exception {
      tracker = PositionTracker.restore(new InMemoryPositionStore(), resume);
      LogReader created =
          new LogReader(
              store,
              store.openSession(),
              tracker,
              ingest,
              errors,
              metrics,
              maxInFlight,
              () -> fatal.set(true));
      created.open(false);
      reader = created;
      thread = new Thread(reader);
      thread.start();
      return reader;
    }

    private List<Operation> take(int count) throws InterruptedException {
      List<Operation> ops = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        ops.add(ingest.poll(5, TimeUnit.SECONDS));
      }
      return ops;
    }

    @AfterEach
    void tearDown() throws Exception {
      if (reader != null) {
        reader.requestStop();
        thread.join(5_000);
      }
    }

    @Test
    @DisplayName("should read only entries after the resume position, numbering them in order")
    void readsAfterResumePosition() throws Exception {
      store.insert("shop.orders", new Document("_id", 1));
      LogPosition resume = store.insert("shop.orders", new Document("_id", 2));
      store.insert("shop.orders", new Document("_id", 3));
      store.noop();
      store.delete("shop.orders", 3);

      start(resume);

      List<Operation> ops = take(2);
      assertThat(ops).extracting(Operation::getKind).containsExactly(OperationKind.INSERT, OperationKind.DELETE);
      assertThat(ops).extracting(Operation::getSequence).containsExactly(0L, 1L);
    }

    @Test
    @DisplayName("should start at the newest entry when nothing is stored")
    void startsAtNewestWithoutPosition() throws Exception {
      store.insert("shop.orders", new Document("_id", 1));

      start(null);
      store.insert("shop.orders", new Document("_id", 2));

      assertThat(take(1).get(0).getDocumentId()).isEqualTo(2);
    }

    @Test
    @DisplayName("should report a read failure and continue on a re-opened cursor")
    void reopensOnce() throws Exception {
      LogPosition resume = store.noop();
      store.insert("shop.orders", new Document("_id", 1));
      store.failNextLogReads(1);

      start(resume);

      assertThat(take(1).get(0).getDocumentId()).isEqualTo(1);
      ArgumentCaptor<TailError> captor = ArgumentCaptor.forClass(TailError.class);
      verify(errors).publish(captor.capture());
      assertThat(captor.getValue().getErrorType()).isEqualTo(ErrorType.TRANSIENT);
      assertThat(store.logCursorsOpened()).isEqualTo(2);
      assertThat(fatal).isFalse();
    }

    @Test
    @DisplayName("should end the session when the re-opened cursor fails again")
    void fatalOnRepeatedFailure() throws Exception {
      store.failNextLogReads(2);

      start(store.noop());

      await().atMost(Duration.ofSeconds(5)).untilTrue(fatal);
      assertThat(ingest.poll(5, TimeUnit.SECONDS)).isNull();
      assertThat(ingest.isEnded()).isTrue();
      ArgumentCaptor<TailError> captor = ArgumentCaptor.forClass(TailError.class);
      verify(errors, times(2)).publish(captor.capture());
      assertThat(captor.getAllValues()).extracting(TailError::getErrorType)
          .containsExactly(ErrorType.TRANSIENT, ErrorType.FATAL);
    }

    @Test
    @DisplayName("should refuse to open when the resume position has rolled off the log")
    void historyLost() throws Exception {
      LogPosition resume = store.noop();
      store.noop();
      store.truncateThrough(LogPosition.of(resume.value() + 1));

      assertThatThrownBy(() -> start(resume)).isInstanceOf(LogHistoryLostException.class);
    }

    @Test
    @DisplayName("acknowledge() should advance only across contiguously settled sequences")
    void acknowledgeWindow() throws Exception {
      LogPosition resume = store.noop();
      store.insert("shop.orders", new Document("_id", 1));
      store.insert("shop.orders", new Document("_id", 2));
      LogPosition p3 = store.insert("shop.orders", new Document("_id", 3));
      start(resume);
      List<Operation> ops = take(3);

      reader.acknowledge(ops.get(1));
      reader.acknowledge(ops.get(2));
      assertThat(tracker.current()).contains(resume);

      reader.acknowledge(ops.get(0));
      assertThat(tracker.current()).contains(p3);
    }
  
    @Test
    @DisplayName("a re-opened cursor should deliver again what was read but not acknowledged")
    void reopenRedeliversUnacknowledged() throws Exception {
      LogPosition resume = store.noop();
      store.insert("shop.orders", new Document("_id", 1));
      store.insert("shop.orders", new Document("_id", 2));
      store.insert("shop.orders", new Document("_id", 3));
      start(resume);
      List<Operation> first = take(3);
      reader.acknowledge(first.get(0));

      store.failNextLogReads(1);

      List<Operation> again = take(2);
      assertThat(again).extracting(Operation::getDocumentId).containsExactly(2, 3);
      assertThat(again).extracting(Operation::getPosition)
          .containsExactly(first.get(1).getPosition(), first.get(2).getPosition());
      assertThat(store.logCursorsOpened()).isEqualTo(2);
      assertThat(fatal).isFalse();
    }

    @Test
    @DisplayName("should stop reading while maxInFlight operations are unsettled")
    void boundsUnsettledOperations() throws Exception {
      LogPosition resume = store.noop();
      for (int i = 0; i < 10; i++) {
        store.insert("shop.orders", new Document("_id", i));
      }
      start(resume, 3);

      List<Operation> ops = take(3);
      assertThat(ingest.poll(300, TimeUnit.MILLISECONDS)).isNull();
      assertThat(metrics.count(MetricKeys.LOG_READ_COUNT)).isLessThanOrEqualTo(4d);

      reader.acknowledge(ops.get(0));

      assertThat(ingest.poll(5, TimeUnit.SECONDS).getDocumentId()).isEqualTo(3);
    }
  }
}
