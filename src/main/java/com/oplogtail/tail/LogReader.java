package com.oplogtail.tail;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.OperationKind;
import com.oplogtail.core.model.TailError;
import com.oplogtail.core.store.LogCursor;
import com.oplogtail.core.store.LogHistoryLostException;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.core.store.RawLogEntry;
import com.oplogtail.core.store.StoreSession;
import com.oplogtail.tail.position.PositionTracker;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the log cursor. Reads raw entries in log order, turns them into sequenced operations and
 * advances the {@link PositionTracker} once operations are settled downstream.
 *
 * <p>A read failure is reported and the cursor re-opened once from the last acknowledged
 * position. A second failure before any successful read, or a lost log history, ends the session.
 *
 * <p>At most {@code maxInFlight} log operations are between this reader and their settlement. A
 * stalled fetch therefore stops the reader instead of growing the re-sequencing buffer.
 */
class LogReader implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(LogReader.class);
  private static final String SOURCE = "LogReader";
  private static final long PERMIT_POLL_MILLIS = 100;

  private final OplogStore store;
  private final StoreSession session;
  private final PositionTracker tracker;
  private final StageQueue<Operation> ingest;
  private final ErrorPublisher errors;
  private final Metrics metrics;
  private final Runnable onFatal;
  private final Semaphore inFlight;

  private final Object ackLock = new Object();
  private final TreeMap<Long, LogPosition> settled = new TreeMap<>();
  private long nextAck;

  private volatile boolean running = true;
  private LogCursor cursor;
  private LogPosition startPosition;
  private long nextSequence;

  LogReader(
      OplogStore store,
      StoreSession session,
      PositionTracker tracker,
      StageQueue<Operation> ingest,
      ErrorPublisher errors,
      Metrics metrics,
      int maxInFlight,
      Runnable onFatal) {
    this.store = store;
    this.session = session;
    this.tracker = tracker;
    this.ingest = ingest;
    this.errors = errors;
    this.metrics = metrics;
    this.onFatal = onFatal;
    this.inFlight = new Semaphore(maxInFlight);
  }

  /**
   * Opens the cursor on the caller's thread so that an unreadable log fails the start.
   *
   * @param directReadEnabled only used to qualify the warning when there is no resume position
   */
  void open(boolean directReadEnabled) {
    Optional<LogPosition> resume = tracker.current();
    if (resume.isPresent()) {
      startPosition = resume.get();
    } else {
      startPosition = store.latestPosition(session).orElse(null);
      if (directReadEnabled) {
        log.info("[LogReader] No resume position, tailing from {}", startPosition);
      } else {
        log.warn("[LogReader] No resume position and no direct read configured, tailing from {}; "
            + "history before this point will not be delivered", startPosition);
      }
    }
    cursor = store.openLogCursor(session, startPosition);
    log.info("[LogReader] Log cursor opened after {}", startPosition);
  }

  @Override
  public void run() {
    boolean reopened = false;
    try {
      while (running) {
        RawLogEntry entry;
        try {
          entry = cursor.tryNext();
        } catch (LogHistoryLostException e) {
          fatal("Log history lost after " + e.getRequested(), e);
          return;
        } catch (RuntimeException e) {
          if (!running) {
            return;
          }
          if (reopened) {
            fatal("Log cursor failed again after re-open", e);
            return;
          }
          errors.publish(TailError.of(ErrorType.TRANSIENT, SOURCE, "Log cursor failed: " + e.getMessage(), e));
          if (!reopen()) {
            return;
          }
          reopened = true;
          continue;
        }
        reopened = false;
        if (entry != null && !publish(entry)) {
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[LogReader] Interrupted while handing off operations");
    } finally {
      closeCursor();
      try {
        ingest.close();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      log.info("[LogReader] Stopped reading, last acknowledged position {}", tracker.current().orElse(null));
    }
  }

  /** Returns false when a stop was requested while waiting for room downstream. */
  private boolean publish(RawLogEntry entry) throws InterruptedException {
    metrics.inc(MetricKeys.LOG_READ_COUNT);
    Optional<Operation> op = normalize(entry);
    if (op.isEmpty()) {
      metrics.inc(MetricKeys.LOG_SKIPPED_COUNT);
      return true;
    }
    while (!inFlight.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (!running) {
        // not acknowledged, so a restart reads it again
        return false;
      }
    }
    try {
      ingest.put(op.get().withSequence(nextSequence++));
    } catch (InterruptedException e) {
      inFlight.release();
      throw e;
    }
    return true;
  }

  private boolean reopen() {
    closeCursor();
    LogPosition from = tracker.current().orElse(startPosition);
    metrics.inc(MetricKeys.LOG_REOPEN_COUNT);
    try {
      cursor = store.openLogCursor(session, from);
      log.info("[LogReader] Log cursor re-opened after {}", from);
      return true;
    } catch (RuntimeException e) {
      fatal("Could not re-open log cursor after " + from, e);
      return false;
    }
  }

  private void fatal(String message, Exception cause) {
    errors.publish(TailError.of(ErrorType.FATAL, SOURCE, message, cause));
    running = false;
    onFatal.run();
  }

  void requestStop() {
    running = false;
  }

  /**
   * Records a settled log operation and advances the tracker across the contiguous run of settled
   * sequence numbers, so the stored position never passes an undelivered operation.
   */
  void acknowledge(Operation op) {
    inFlight.release();
    synchronized (ackLock) {
      settled.put(op.getSequence(), op.getPosition());
      LogPosition advanceTo = null;
      while (!settled.isEmpty() && settled.firstKey() == nextAck) {
        advanceTo = settled.pollFirstEntry().getValue();
        nextAck++;
      }
      if (advanceTo != null) {
        tracker.advance(advanceTo);
      }
    }
  }

  private void closeCursor() {
    if (cursor == null) {
      return;
    }
    try {
      cursor.close();
    } catch (RuntimeException e) {
      log.warn("[LogReader] Error while closing log cursor", e);
    }
    cursor = null;
  }

  /** Maps a raw entry to an operation; no-ops, unsupported commands and system collections yield empty. */
  static Optional<Operation> normalize(RawLogEntry entry) {
    if (entry.getOp() == null || entry.getNs() == null || entry.getNs().isEmpty()) {
      return Optional.empty();
    }
    Namespace ns;
    try {
      ns = Namespace.parse(entry.getNs());
    } catch (IllegalArgumentException e) {
      log.debug("[LogReader] Skipping entry with namespace {}", entry.getNs());
      return Optional.empty();
    }
    if (ns.isSystem()) {
      return Optional.empty();
    }
    Document o = entry.getObject();
    Operation.OperationBuilder builder = Operation.builder().position(entry.getPosition());
    switch (entry.getOp()) {
      case "i":
        return Optional.of(
            builder.kind(OperationKind.INSERT).namespace(ns)
                .documentId(o != null ? o.get("_id") : null)
                .body(o)
                .partial(o == null)
                .build());
      case "u":
        Document o2 = entry.getObject2();
        return Optional.of(
            builder.kind(OperationKind.UPDATE).namespace(ns)
                .documentId(o2 != null ? o2.get("_id") : null)
                .body(o)
                .partial(isDelta(o))
                .build());
      case "d":
        return Optional.of(
            builder.kind(OperationKind.DELETE).namespace(ns)
                .documentId(o != null ? o.get("_id") : null)
                .body(o)
                .build());
      case "c":
        return command(builder, ns, o);
      default:
        return Optional.empty();
    }
  }

  private static Optional<Operation> command(
      Operation.OperationBuilder builder, Namespace ns, Document o) {
    if (o == null || !ns.isCommand()) {
      return Optional.empty();
    }
    if (o.containsKey("drop")) {
      return Optional.of(
          builder.kind(OperationKind.DROP).namespace(ns.withCollection(o.getString("drop"))).build());
    }
    if (o.containsKey("dropDatabase")) {
      return Optional.of(
          builder.kind(OperationKind.DROP).namespace(Namespace.database(ns.getDatabase())).build());
    }
    return Optional.empty();
  }

  /** Operator-style updates ({@code $set}, {@code $v} diffs) are deltas; replacements are full. */
  static boolean isDelta(Document o) {
    return o == null || o.keySet().stream().anyMatch(key -> key.startsWith("$"));
  }
}
