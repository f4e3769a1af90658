package com.oplogtail.tail;

import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.core.store.StoreSession;
import com.oplogtail.tail.position.PositionTracker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One running pipeline:
 *
 * <pre>
 * LogReader ─┐
 *            ├─ ingest ─ Batcher ─ batches ─ FetchWorkerPool ─ fetched ─ OrderingMerger ─ dispatch ─ Dispatcher
 * DirectRead ┘
 * </pre>
 *
 * <p>Stopping only tells the producers to stop. The end of each queue then travels downstream behind
 * the buffered work, so everything in flight is dispatched or reported before the session ends.
 */
class TailSession {

  private static final Logger log = LoggerFactory.getLogger(TailSession.class);
  private static final Duration POOL_GRACE = Duration.ofSeconds(30);

  private final OplogStore store;
  private final TailConfig config;
  private final PositionTracker tracker;
  private final Runnable onFatal;
  private final Runnable onTerminated;
  private final CountDownLatch terminated = new CountDownLatch(1);

  private final ErrorPublisher errors;
  private final StageQueue<Operation> ingest;
  private final StageQueue<List<Operation>> batches;
  private final StageQueue<FetchResult> fetched;
  private final StageQueue<Operation> dispatch;

  private final Metrics readerMetrics;
  private final Metrics directReadMetrics;
  private final Metrics batchMetrics;
  private final Metrics fetchMetrics;
  private final Metrics mergerMetrics;
  private final Metrics dispatchMetrics;
  private final TailHandlers handlers;

  private StoreSession storeSession;
  private LogReader logReader;
  private DirectReadCoordinator directRead;
  private FetchWorkerPool workers;
  private Thread readerThread;
  private Thread batcherThread;
  private Thread mergerThread;
  private Thread dispatcherThread;

  TailSession(
      OplogStore store,
      TailConfig config,
      TailHandlers handlers,
      PositionTracker tracker,
      MeterRegistry registry,
      Runnable onFatal,
      Runnable onTerminated) {
    this.store = store;
    this.config = config;
    this.handlers = handlers;
    this.tracker = tracker;
    this.onFatal = onFatal;
    this.onTerminated = onTerminated;

    String name = config.getName();
    this.errors =
        new ErrorPublisher(handlers.getOnError(), new Metrics(registry, name, "ErrorPublisher"), name + "-errors");
    int producers = config.hasDirectRead() ? 2 : 1;
    this.ingest = new StageQueue<>("ingest", config.getChannelSize(), producers);
    this.batches = new StageQueue<>("batches", config.getChannelSize(), 1);
    this.fetched = new StageQueue<>("fetched", config.getChannelSize(), config.getWorkerCount());
    this.dispatch = new StageQueue<>("dispatch", config.getChannelSize(), 1);

    this.readerMetrics = new Metrics(registry, name, "LogReader");
    this.directReadMetrics = new Metrics(registry, name, "DirectRead");
    this.batchMetrics = new Metrics(registry, name, "Batcher");
    this.fetchMetrics = new Metrics(registry, name, "FetchWorkerPool");
    this.mergerMetrics = new Metrics(registry, name, "OrderingMerger");
    this.dispatchMetrics = new Metrics(registry, name, "Dispatcher");
  }

  /** Acquires the store session and opens the log cursor; no thread is running yet. */
  void open() {
    storeSession = store.openSession();
    try {
      logReader =
          new LogReader(
              store,
              storeSession,
              tracker,
              ingest,
              errors,
              readerMetrics,
              config.maxInFlightLogOperations(),
              onFatal);
      logReader.open(config.hasDirectRead());
    } catch (RuntimeException e) {
      storeSession.close();
      throw e;
    }
    directRead =
        new DirectReadCoordinator(
            store,
            storeSession,
            config.directReadTargets(),
            config.getDirectReadersPerCollection(),
            config.getDirectReadBatchSize(),
            config.getDirectReadLimit(),
            ingest,
            errors,
            directReadMetrics,
            config.getName());
    workers =
        new FetchWorkerPool(
            store,
            storeSession,
            batches,
            fetched,
            config.getWorkerCount(),
            config.isUpdateDataAsDelta(),
            errors,
            fetchMetrics,
            config.getName());
  }

  /** Starts every stage, consumers first. */
  void launch() {
    String name = config.getName();
    errors.start();

    Dispatcher dispatcher =
        new Dispatcher(
            dispatch,
            config.namespaceFilter(),
            handlers,
            this::settled,
            errors,
            dispatchMetrics,
            onFatal);
    dispatcherThread = newThread(name + "-dispatcher", () -> {
      try {
        dispatcher.run();
      } finally {
        finish();
      }
    });
    OrderingMerger merger =
        new OrderingMerger(fetched, dispatch, config.getOrdering(), this::settled, mergerMetrics);
    mergerThread = newThread(name + "-merger", merger);
    Batcher batcher =
        new Batcher(ingest, batches, new BatchWindow(config.getBufferSize(), config.getBufferDuration()), batchMetrics);
    batcherThread = newThread(name + "-batcher", batcher);
    readerThread = newThread(name + "-reader", logReader);

    dispatcherThread.start();
    mergerThread.start();
    workers.start();
    batcherThread.start();
    directRead.start();
    readerThread.start();
    log.info("[TailSession] {} running with {} workers, ordering {}",
        name, config.getWorkerCount(), config.getOrdering());
  }

  void settled(Operation op) {
    if (op.isFromLog()) {
      logReader.acknowledge(op);
    } else {
      directRead.settle(op);
    }
  }

  void requestStop() {
    log.info("[TailSession] {} draining", config.getName());
    logReader.requestStop();
    directRead.requestStop();
  }

  private void finish() {
    try {
      awaitPools();
      errors.close();
      directRead.release();
      storeSession.close();
    } catch (RuntimeException e) {
      log.error("[TailSession] Failed to release session resources", e);
    } finally {
      log.info("[TailSession] {} stopped at position {}",
          config.getName(), tracker.current().map(LogPosition::toString).orElse("<none>"));
      onTerminated.run();
      terminated.countDown();
    }
  }

  private void awaitPools() {
    try {
      if (!workers.awaitTermination(POOL_GRACE)) {
        workers.shutdownNow();
      }
      if (!directRead.awaitTermination(POOL_GRACE)) {
        directRead.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
      directRead.shutdownNow();
    }
  }

  boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (timeout == null) {
      terminated.await();
      return true;
    }
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Threads on which handler callbacks run; they must not wait for the session to end. */
  boolean isCallbackThread(Thread thread) {
    return thread == dispatcherThread || thread == errors.thread();
  }

  DirectReadCoordinator directRead() {
    return directRead;
  }

  Optional<LogPosition> currentPosition() {
    return tracker.current();
  }

  private static Thread newThread(String name, Runnable runnable) {
    Thread thread = new Thread(runnable, name);
    thread.setDaemon(true);
    return thread;
  }
}
