package com.oplogtail.tail;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.Operation;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-sequences fetch results. With {@link OrderingGuarantee#ORDERED}, log-origin results are held
 * until every lower sequence number has been released; direct-read results are never held. The
 * held results are bounded by the reader's in-flight limit.
 */
class OrderingMerger implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(OrderingMerger.class);

  private final StageQueue<FetchResult> results;
  private final StageQueue<Operation> dispatch;
  private final OrderingGuarantee ordering;
  private final SettlementListener settlement;
  private final Metrics metrics;
  private final TreeMap<Long, FetchResult> held = new TreeMap<>();
  private long nextSequence;

  OrderingMerger(
      StageQueue<FetchResult> results,
      StageQueue<Operation> dispatch,
      OrderingGuarantee ordering,
      SettlementListener settlement,
      Metrics metrics) {
    this.results = results;
    this.dispatch = dispatch;
    this.ordering = ordering;
    this.settlement = settlement;
    this.metrics = metrics;
  }

  @Override
  public void run() {
    try {
      FetchResult result;
      while ((result = results.take()) != null) {
        accept(result);
      }
      releaseRemaining();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[OrderingMerger] Interrupted with {} results held", held.size());
    } finally {
      try {
        dispatch.close();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  void accept(FetchResult result) throws InterruptedException {
    Operation op = result.getOperation();
    if (ordering == OrderingGuarantee.UNORDERED || !op.isFromLog()) {
      release(result);
      return;
    }
    long sequence = op.getSequence();
    if (sequence < nextSequence) {
      // already passed; can only happen for a duplicate sequence
      log.warn("[OrderingMerger] Late result for sequence {} (next {}), releasing as is", sequence, nextSequence);
      release(result);
      return;
    }
    if (sequence != nextSequence) {
      held.put(sequence, result);
      metrics.inc(MetricKeys.MERGER_HELD_COUNT);
      return;
    }
    release(result);
    nextSequence++;
    releaseContiguous();
  }

  private void releaseContiguous() throws InterruptedException {
    while (!held.isEmpty() && held.firstKey() == nextSequence) {
      release(held.pollFirstEntry().getValue());
      nextSequence++;
    }
  }

  /** End of stream: nothing can fill the gaps any more, release what is held in order. */
  private void releaseRemaining() throws InterruptedException {
    if (!held.isEmpty()) {
      log.warn("[OrderingMerger] Releasing {} results past a gap at sequence {}", held.size(), nextSequence);
    }
    for (Map.Entry<Long, FetchResult> entry : held.entrySet()) {
      release(entry.getValue());
    }
    held.clear();
  }

  private void release(FetchResult result) throws InterruptedException {
    if (result.isDropped()) {
      settlement.settled(result.getOperation());
    } else {
      dispatch.put(result.getOperation());
    }
  }

  int heldCount() {
    return held.size();
  }
}
