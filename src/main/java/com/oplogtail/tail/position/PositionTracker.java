package com.oplogtail.tail.position;

import com.oplogtail.core.model.LogPosition;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the last acknowledged log position. Advances are monotonic: a position that is not
 * strictly after the current one is ignored, so replays are harmless.
 */
public class PositionTracker {

  private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

  private final PositionStore store;
  private LogPosition current;

  private PositionTracker(PositionStore store, LogPosition initial) {
    this.store = store;
    this.current = initial;
  }

  /**
   * Restores the tracker. An explicit resume position wins over the stored checkpoint.
   *
   * @throws IOException if the stored checkpoint cannot be read
   */
  public static PositionTracker restore(PositionStore store, LogPosition resumePosition)
      throws IOException {
    if (resumePosition != null) {
      log.info("[PositionTracker] Resuming from configured position {}", resumePosition);
      return new PositionTracker(store, resumePosition);
    }
    Optional<LogPosition> stored = store.load();
    stored.ifPresent(p -> log.info("[PositionTracker] Resuming from checkpoint {}", p));
    return new PositionTracker(store, stored.orElse(null));
  }

  public synchronized Optional<LogPosition> current() {
    return Optional.ofNullable(current);
  }

  /** Returns whether the position moved. */
  public synchronized boolean advance(LogPosition position) {
    if (position == null || !position.isAfter(current)) {
      return false;
    }
    current = position;
    try {
      store.save(position);
    } catch (IOException e) {
      log.error("[PositionTracker] Failed to persist position {}", position, e);
    }
    return true;
  }
}
