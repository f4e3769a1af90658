package com.oplogtail.tail;

import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.tail.position.FilePositionStore;
import com.oplogtail.tail.position.InMemoryPositionStore;
import com.oplogtail.tail.position.PositionStore;
import com.oplogtail.tail.position.PositionTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for consumers: starts one tailing session against an {@link OplogStore} and drives
 * it through {@link TailState}. A tailer is single use; once stopped it cannot be started again.
 *
 * <pre>{@code
 * OplogTailer tailer = new OplogTailer(store);
 * tailer.start(config, TailHandlers.of(handler));
 * tailer.awaitSnapshotComplete();
 * ...
 * tailer.stop();
 * }</pre>
 */
public class OplogTailer {

  private static final Logger log = LoggerFactory.getLogger(OplogTailer.class);

  private final OplogStore store;
  private final PositionStore positionStore;
  private final MeterRegistry registry;

  private final Object lock = new Object();
  private volatile TailState state = TailState.CREATED;
  private volatile TailSession session;

  public OplogTailer(OplogStore store) {
    this(store, null, new SimpleMeterRegistry());
  }

  /**
   * @param positionStore where acknowledged positions are checkpointed; when null the config's
   *     position file is used, or memory if that is unset too
   */
  public OplogTailer(OplogStore store, PositionStore positionStore, MeterRegistry registry) {
    this.store = Objects.requireNonNull(store, "store");
    this.positionStore = positionStore;
    this.registry = registry != null ? registry : new SimpleMeterRegistry();
  }

  /**
   * Validates the config, opens the log cursor and starts the pipeline.
   *
   * @throws IllegalArgumentException if the config is invalid; nothing has been started
   * @throws IllegalStateException if this tailer was already started
   * @throws UncheckedIOException if the stored position cannot be read
   */
  public void start(TailConfig config, TailHandlers handlers) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(handlers, "handlers");
    config.validate();

    synchronized (lock) {
      if (state != TailState.CREATED) {
        throw new IllegalStateException("Tailer already used, state " + state);
      }
      PositionTracker tracker;
      try {
        tracker = PositionTracker.restore(resolvePositionStore(config), config.getResumePosition());
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to restore the log position", e);
      }
      TailSession created =
          new TailSession(store, config, handlers, tracker, registry, this::onFatal, this::onTerminated);
      created.open();
      session = created;
      state = TailState.RUNNING;
      created.launch();
    }
    log.info("[OplogTailer] {} started", config.getName());
  }

  private PositionStore resolvePositionStore(TailConfig config) {
    if (positionStore != null) {
      return positionStore;
    }
    if (config.getPositionFile() != null) {
      return new FilePositionStore(config.getPositionFile());
    }
    return new InMemoryPositionStore();
  }

  /** Stops and waits for the drain without a time limit. */
  public void stop() {
    stop(null);
  }

  /**
   * Stops reading and waits until everything already read has been dispatched. Called from a
   * handler it only starts the drain, since the handler's own thread is part of it.
   *
   * @return whether the tailer reached {@link TailState#STOPPED} within the timeout
   */
  public boolean stop(Duration timeout) {
    TailSession current;
    synchronized (lock) {
      if (state == TailState.CREATED) {
        state = TailState.STOPPED;
        log.info("[OplogTailer] Stopped before start");
        return true;
      }
      current = session;
      if (state == TailState.RUNNING) {
        state = TailState.DRAINING;
        current.requestStop();
      }
    }
    if (current.isCallbackThread(Thread.currentThread())) {
      return state == TailState.STOPPED;
    }
    return awaitStopped(timeout);
  }

  private void onFatal() {
    synchronized (lock) {
      if (state != TailState.RUNNING) {
        return;
      }
      log.error("[OplogTailer] Fatal error, draining");
      state = TailState.DRAINING;
      session.requestStop();
    }
  }

  private void onTerminated() {
    synchronized (lock) {
      state = TailState.STOPPED;
    }
    log.info("[OplogTailer] Stopped");
  }

  /** Blocks until the direct read has finished; returns false if the session stopped first. */
  public boolean awaitSnapshotComplete() throws InterruptedException {
    return awaitSnapshotComplete(null);
  }

  public boolean awaitSnapshotComplete(Duration timeout) throws InterruptedException {
    return requireSession().directRead().awaitComplete(timeout);
  }

  /**
   * @throws IllegalArgumentException if the namespace is not one of the direct-read namespaces
   */
  public boolean awaitNamespaceComplete(Namespace namespace, Duration timeout)
      throws InterruptedException {
    return requireSession().directRead().awaitNamespace(namespace, timeout);
  }

  /** Waits for {@link TailState#STOPPED}; a null timeout waits indefinitely. */
  public boolean awaitStopped(Duration timeout) {
    TailSession current;
    synchronized (lock) {
      if (state == TailState.STOPPED) {
        return true;
      }
      current = session;
    }
    if (current == null) {
      return false;
    }
    try {
      return current.awaitTermination(timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public TailState state() {
    return state;
  }

  /** The last acknowledged position, empty before anything was acknowledged. */
  public Optional<LogPosition> currentPosition() {
    TailSession current = session;
    return current == null ? Optional.empty() : current.currentPosition();
  }

  private TailSession requireSession() {
    TailSession current = session;
    if (current == null) {
      throw new IllegalStateException("Tailer not started");
    }
    return current;
  }
}
