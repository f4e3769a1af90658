package com.oplogtail.tail;

import com.oplogtail.core.model.Operation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Accumulates operations until {@code maxSize} is reached or {@code maxLatency} has passed since
 * the first operation arrived, whichever comes first.
 */
final class BatchWindow {

  private final int maxSize;
  private final long maxLatencyNanos;
  private final LongSupplier nanoClock;
  private final List<Operation> operations;
  private long openedAt;

  BatchWindow(int maxSize, Duration maxLatency) {
    this(maxSize, maxLatency, System::nanoTime);
  }

  BatchWindow(int maxSize, Duration maxLatency, LongSupplier nanoClock) {
    this.maxSize = maxSize;
    this.maxLatencyNanos = maxLatency.toNanos();
    this.nanoClock = nanoClock;
    this.operations = new ArrayList<>(maxSize);
  }

  /** Adds an operation and reports whether the window is now full. */
  boolean add(Operation operation) {
    if (operations.isEmpty()) {
      openedAt = nanoClock.getAsLong();
    }
    operations.add(operation);
    return operations.size() >= maxSize;
  }

  boolean isEmpty() {
    return operations.isEmpty();
  }

  int size() {
    return operations.size();
  }

  /** Time left before the latency bound forces a flush; only meaningful while non-empty. */
  long remainingNanos() {
    return Math.max(0L, openedAt + maxLatencyNanos - nanoClock.getAsLong());
  }

  boolean isExpired() {
    return !operations.isEmpty() && remainingNanos() == 0L;
  }

  List<Operation> drain() {
    List<Operation> batch = List.copyOf(operations);
    operations.clear();
    return batch;
  }
}
