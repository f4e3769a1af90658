package com.oplogtail.tail;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.Operation;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Groups ingested operations into {@link BatchWindow}s and hands closed windows to the workers. */
class Batcher implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(Batcher.class);

  private final StageQueue<Operation> ingest;
  private final StageQueue<List<Operation>> batches;
  private final BatchWindow window;
  private final Metrics metrics;

  Batcher(
      StageQueue<Operation> ingest,
      StageQueue<List<Operation>> batches,
      BatchWindow window,
      Metrics metrics) {
    this.ingest = ingest;
    this.batches = batches;
    this.window = window;
    this.metrics = metrics;
  }

  @Override
  public void run() {
    try {
      while (true) {
        Operation op;
        if (window.isEmpty()) {
          op = ingest.take();
          if (op == null) {
            break;
          }
        } else {
          op = ingest.poll(window.remainingNanos(), TimeUnit.NANOSECONDS);
          if (op == null) {
            if (ingest.isEnded()) {
              break;
            }
            if (window.isExpired()) {
              metrics.inc(MetricKeys.BATCH_TIMER_FLUSH_COUNT);
              flush();
            }
            continue;
          }
        }
        if (window.add(op)) {
          metrics.inc(MetricKeys.BATCH_SIZE_FLUSH_COUNT);
          flush();
        }
      }
      if (!window.isEmpty()) {
        flush();
      }
      log.debug("[Batcher] Ingest ended, batching finished");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[Batcher] Interrupted with {} operations in the open window", window.size());
    } finally {
      closeQuietly();
    }
  }

  private void flush() throws InterruptedException {
    batches.put(window.drain());
  }

  private void closeQuietly() {
    try {
      batches.close();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[Batcher] Interrupted while closing {}", batches.name());
    }
  }
}
