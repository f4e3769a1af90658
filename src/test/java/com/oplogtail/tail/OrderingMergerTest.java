package com.oplogtail.tail;

import static org.assertj.core.api.Assertions.assertThat;

import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.OperationKind;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderingMergerTest {

  private final StageQueue<FetchResult> results = new StageQueue<>("fetched", 100, 1);
  private final StageQueue<Operation> dispatch = new StageQueue<>("dispatch", 100, 1);
  private final List<Operation> settled = new CopyOnWriteArrayList<>();
  private final Metrics metrics = new Metrics(null, "test", "OrderingMerger");

  private static Operation logOp(long sequence) {
    return Operation.builder()
        .kind(OperationKind.INSERT)
        .namespace(Namespace.parse("shop.orders"))
        .documentId(sequence)
        .body(new Document("_id", sequence))
        .sequence(sequence)
        .build();
  }

  private OrderingMerger merger(OrderingGuarantee ordering) {
    return new OrderingMerger(results, dispatch, ordering, settled::add, metrics);
  }

  private List<Long> dispatched() throws InterruptedException {
    dispatch.close();
    List<Long> sequences = new ArrayList<>();
    Operation op;
    while ((op = dispatch.take()) != null) {
      sequences.add(op.getSequence());
    }
    return sequences;
  }

  @Test
  @DisplayName("ORDERED should hold results until the gap before them is filled")
  void orderedHoldsUntilContiguous() throws Exception {
    OrderingMerger merger = merger(OrderingGuarantee.ORDERED);

    merger.accept(FetchResult.delivered(logOp(2)));
    merger.accept(FetchResult.delivered(logOp(1)));
    assertThat(merger.heldCount()).isEqualTo(2);

    merger.accept(FetchResult.delivered(logOp(0)));
    merger.accept(FetchResult.delivered(logOp(3)));

    assertThat(merger.heldCount()).isZero();
    assertThat(dispatched()).containsExactly(0L, 1L, 2L, 3L);
  }

  @Test
  @DisplayName("ORDERED should settle dropped results in place so the sequence keeps moving")
  void droppedResultsAdvanceSequence() throws Exception {
    OrderingMerger merger = merger(OrderingGuarantee.ORDERED);

    merger.accept(FetchResult.delivered(logOp(2)));
    merger.accept(FetchResult.dropped(logOp(1)));
    merger.accept(FetchResult.delivered(logOp(0)));

    assertThat(settled).extracting(Operation::getSequence).containsExactly(1L);
    assertThat(dispatched()).containsExactly(0L, 2L);
  }

  @Test
  @DisplayName("UNORDERED should release results as they arrive")
  void unorderedReleasesImmediately() throws Exception {
    OrderingMerger merger = merger(OrderingGuarantee.UNORDERED);

    merger.accept(FetchResult.delivered(logOp(2)));
    merger.accept(FetchResult.delivered(logOp(0)));
    merger.accept(FetchResult.delivered(logOp(1)));

    assertThat(dispatched()).containsExactly(2L, 0L, 1L);
  }

  @Test
  @DisplayName("direct-read results should bypass the sequence")
  void directReadsBypassSequence() throws Exception {
    OrderingMerger merger = merger(OrderingGuarantee.ORDERED);
    Operation snapshot = Operation.directRead(Namespace.parse("shop.orders"), new Document("_id", 99));

    merger.accept(FetchResult.delivered(logOp(1)));
    merger.accept(FetchResult.delivered(snapshot));

    assertThat(merger.heldCount()).isEqualTo(1);
    assertThat(dispatch.take()).isSameAs(snapshot);
  }

  @Test
  @DisplayName("run() should release held results in order when the input ends")
  void releasesRemainderAtEnd() throws Exception {
    results.put(FetchResult.delivered(logOp(3)));
    results.put(FetchResult.delivered(logOp(1)));
    results.close();

    merger(OrderingGuarantee.ORDERED).run();

    List<Long> sequences = new ArrayList<>();
    Operation op;
    while ((op = dispatch.take()) != null) {
      sequences.add(op.getSequence());
    }
    assertThat(sequences).containsExactly(1L, 3L);
  }
}
