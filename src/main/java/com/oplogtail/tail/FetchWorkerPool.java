package com.oplogtail.tail;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.core.store.StoreSession;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of workers that complete partial operations with the current document from the store.
 *
 * <p>A document that no longer exists drops its operation with a warning. A failed fetch is
 * reported on the error channel and drops only that operation; nothing is retried in line.
 */
class FetchWorkerPool {

  private static final Logger log = LoggerFactory.getLogger(FetchWorkerPool.class);
  private static final String SOURCE = "FetchWorkerPool";

  private final OplogStore store;
  private final StoreSession session;
  private final StageQueue<List<Operation>> batches;
  private final StageQueue<FetchResult> results;
  private final int workerCount;
  private final boolean updateDataAsDelta;
  private final ErrorPublisher errors;
  private final Metrics metrics;
  private final ExecutorService executor;

  FetchWorkerPool(
      OplogStore store,
      StoreSession session,
      StageQueue<List<Operation>> batches,
      StageQueue<FetchResult> results,
      int workerCount,
      boolean updateDataAsDelta,
      ErrorPublisher errors,
      Metrics metrics,
      String threadPrefix) {
    this.store = store;
    this.session = session;
    this.batches = batches;
    this.results = results;
    this.workerCount = workerCount;
    this.updateDataAsDelta = updateDataAsDelta;
    this.errors = errors;
    this.metrics = metrics;
    this.executor =
        Executors.newFixedThreadPool(
            workerCount,
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat(threadPrefix + "-fetch-%d").build());
  }

  void start() {
    for (int i = 0; i < workerCount; i++) {
      executor.execute(this::work);
    }
    executor.shutdown();
  }

  boolean awaitTermination(Duration timeout) throws InterruptedException {
    return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  void shutdownNow() {
    executor.shutdownNow();
  }

  private void work() {
    try {
      List<Operation> batch;
      while ((batch = batches.take()) != null) {
        for (Operation op : batch) {
          results.put(process(op));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[FetchWorker] Interrupted, in-flight batch abandoned");
    } finally {
      try {
        results.close();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  FetchResult process(Operation op) {
    if (!needsFetch(op)) {
      return FetchResult.delivered(op);
    }
    try {
      Optional<Document> document = store.fetchById(session, op.getNamespace(), op.getDocumentId());
      if (document.isEmpty()) {
        metrics.inc(MetricKeys.FETCH_MISSING_COUNT);
        log.warn("[FetchWorker] Document {} in {} no longer exists, dropping {}",
            op.getDocumentId(), op.getNamespace(), op.getKind());
        return FetchResult.dropped(op);
      }
      metrics.inc(MetricKeys.FETCH_SUCCESS_COUNT);
      return FetchResult.delivered(op.withBody(document.get()));
    } catch (RuntimeException e) {
      metrics.inc(MetricKeys.FETCH_ERROR_COUNT);
      errors.publish(
          TailError.of(
              ErrorType.FETCH,
              SOURCE,
              "Failed to fetch " + op.getDocumentId() + " from " + op.getNamespace(),
              op,
              e));
      return FetchResult.dropped(op);
    }
  }

  boolean needsFetch(Operation op) {
    if (!op.isPartial()) {
      return false;
    }
    if (op.isInsert()) {
      return true;
    }
    return op.isUpdate() && !updateDataAsDelta;
  }
}
