package com.oplogtail.tail;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;
import com.oplogtail.core.store.DocumentCursor;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.core.store.ShardSpec;
import com.oplogtail.core.store.StoreSession;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-time snapshot of existing documents. Each namespace is split into {@code readersPerCollection}
 * shards scanned concurrently; every document becomes a direct-read insert.
 *
 * <p>A namespace is complete once all of its shards are exhausted and every operation they emitted
 * has been settled by the dispatcher. Documents changed during the scan may also arrive from the
 * live log; such duplicates are expected.
 */
class DirectReadCoordinator {

  private static final Logger log = LoggerFactory.getLogger(DirectReadCoordinator.class);
  private static final String SOURCE = "DirectReadCoordinator";
  static final int MAX_SCAN_THREADS = 8;

  private final OplogStore store;
  private final StoreSession session;
  private final int readersPerCollection;
  private final int batchSize;
  private final int limit;
  private final StageQueue<Operation> ingest;
  private final ErrorPublisher errors;
  private final Metrics metrics;
  private final String threadPrefix;

  private final Map<Namespace, NamespaceProgress> progress = new LinkedHashMap<>();
  private final AtomicInteger remainingNamespaces;
  private final AtomicInteger remainingTasks = new AtomicInteger();
  private final CountDownLatch done = new CountDownLatch(1);
  private volatile boolean complete;
  private volatile boolean running = true;
  private ExecutorService executor;

  DirectReadCoordinator(
      OplogStore store,
      StoreSession session,
      List<Namespace> namespaces,
      int readersPerCollection,
      int batchSize,
      int limit,
      StageQueue<Operation> ingest,
      ErrorPublisher errors,
      Metrics metrics,
      String threadPrefix) {
    this.store = store;
    this.session = session;
    this.readersPerCollection = readersPerCollection;
    this.batchSize = batchSize;
    this.limit = limit;
    this.ingest = ingest;
    this.errors = errors;
    this.metrics = metrics;
    this.threadPrefix = threadPrefix;
    for (Namespace ns : namespaces) {
      progress.put(ns, new NamespaceProgress(ns, readersPerCollection));
    }
    this.remainingNamespaces = new AtomicInteger(progress.size());
    if (progress.isEmpty()) {
      complete = true;
      done.countDown();
    }
  }

  /** Starts the shard scans; a coordinator without namespaces does nothing. */
  void start() {
    if (progress.isEmpty()) {
      return;
    }
    int tasks = progress.size() * readersPerCollection;
    int threads = scanThreads(progress.size(), readersPerCollection);
    remainingTasks.set(tasks);
    executor =
        Executors.newFixedThreadPool(
            threads,
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat(threadPrefix + "-direct-%d").build());
    log.info("[DirectRead] Reading {} namespaces with {} readers each on {} threads",
        progress.size(), readersPerCollection, threads);
    for (NamespaceProgress ns : progress.values()) {
      for (int i = 0; i < readersPerCollection; i++) {
        ShardSpec shard = ShardSpec.of(i, readersPerCollection);
        executor.execute(() -> scan(ns, shard));
      }
    }
    executor.shutdown();
  }

  /**
   * Shards beyond the pool size wait for a free thread. One namespace's shards always fit, so they
   * are scanned concurrently.
   */
  static int scanThreads(int namespaces, int readersPerCollection) {
    return Math.min(
        namespaces * readersPerCollection, Math.max(readersPerCollection, MAX_SCAN_THREADS));
  }

  private void scan(NamespaceProgress ns, ShardSpec shard) {
    boolean exhausted = false;
    long count = 0;
    try (DocumentCursor cursor = store.scanShard(session, ns.namespace, shard, batchSize, limit)) {
      while (running && cursor.hasNext()) {
        Document document = cursor.next();
        ns.emitted();
        try {
          ingest.put(Operation.directRead(ns.namespace, document));
        } catch (InterruptedException e) {
          ns.settled();
          throw e;
        }
        metrics.inc(MetricKeys.DIRECT_READ_COUNT);
        count++;
      }
      exhausted = running;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[DirectRead] Shard {} of {} interrupted", shard, ns.namespace);
    } catch (RuntimeException e) {
      metrics.inc(MetricKeys.DIRECT_READ_ERROR_COUNT);
      errors.publish(
          TailError.of(
              ErrorType.TRANSIENT,
              SOURCE,
              "Direct read of " + ns.namespace + " shard " + shard + " failed after " + count + " documents",
              e));
      // a failed shard still counts as finished
      exhausted = running;
    } finally {
      log.debug("[DirectRead] Shard {} of {} read {} documents", shard, ns.namespace, count);
      ns.shardDone(exhausted);
      if (remainingTasks.decrementAndGet() == 0) {
        closeIngest();
      }
    }
  }

  private void closeIngest() {
    try {
      ingest.close();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Called by the dispatcher path once a direct-read operation is delivered, filtered or dropped. */
  void settle(Operation op) {
    NamespaceProgress ns = progress.get(op.getNamespace());
    if (ns != null) {
      ns.settled();
    }
  }

  void requestStop() {
    running = false;
  }

  /** Wakes every waiter once the session has ended, complete or not. */
  void release() {
    for (NamespaceProgress ns : progress.values()) {
      ns.latch.countDown();
    }
    done.countDown();
  }

  boolean awaitComplete(Duration timeout) throws InterruptedException {
    if (timeout == null) {
      done.await();
    } else if (!done.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return false;
    }
    return complete;
  }

  boolean awaitNamespace(Namespace namespace, Duration timeout) throws InterruptedException {
    NamespaceProgress ns = progress.get(namespace);
    if (ns == null) {
      throw new IllegalArgumentException("Namespace is not part of the direct read: " + namespace);
    }
    if (timeout == null) {
      ns.latch.await();
    } else if (!ns.latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return false;
    }
    return ns.isComplete();
  }

  boolean isComplete() {
    return complete;
  }

  boolean awaitTermination(Duration timeout) throws InterruptedException {
    return executor == null || executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  void shutdownNow() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  private void namespaceComplete(NamespaceProgress ns) {
    log.info("[DirectRead] Imported all documents of {}", ns.namespace);
    if (remainingNamespaces.decrementAndGet() == 0) {
      complete = true;
      done.countDown();
      log.info("[DirectRead] Imported all the collections");
    }
  }

  private final class NamespaceProgress {

    private final Namespace namespace;
    private final CountDownLatch latch = new CountDownLatch(1);
    private int remainingShards;
    private long outstanding;
    private boolean interrupted;
    private boolean complete;

    NamespaceProgress(Namespace namespace, int shards) {
      this.namespace = namespace;
      this.remainingShards = shards;
    }

    synchronized void emitted() {
      outstanding++;
    }

    void settled() {
      boolean nowComplete;
      synchronized (this) {
        outstanding--;
        nowComplete = checkComplete();
      }
      if (nowComplete) {
        namespaceComplete(this);
      }
    }

    void shardDone(boolean exhausted) {
      boolean nowComplete;
      synchronized (this) {
        remainingShards--;
        interrupted |= !exhausted;
        nowComplete = checkComplete();
      }
      if (nowComplete) {
        namespaceComplete(this);
      }
    }

    synchronized boolean isComplete() {
      return complete;
    }

    private boolean checkComplete() {
      if (complete || interrupted || remainingShards > 0 || outstanding > 0) {
        return false;
      }
      complete = true;
      latch.countDown();
      return true;
    }
  }
}
