package com.oplogtail.tail;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded hand-off between two pipeline stages. {@link #put} blocks while the queue is full, which
 * is how a slow downstream stage throttles its producers.
 *
 * <p>The queue ends once each of its registered producers has called {@link #close()}. Every
 * consumer then sees the end after the remaining items, so several consumers may share one queue.
 */
final class StageQueue<T> {

  private static final Object END = new Object();

  private final String name;
  private final BlockingQueue<Object> queue;
  private final AtomicInteger openProducers;
  private volatile boolean ended;

  StageQueue(String name, int capacity, int producers) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    if (producers <= 0) {
      throw new IllegalArgumentException("producers must be positive");
    }
    this.name = name;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.openProducers = new AtomicInteger(producers);
  }

  void put(T item) throws InterruptedException {
    if (item == null) {
      throw new IllegalArgumentException("item must not be null");
    }
    queue.put(item);
  }

  /** Blocks for the next item; returns {@code null} once the queue has ended. */
  T take() throws InterruptedException {
    return unwrap(queue.take());
  }

  /** Returns {@code null} on timeout or end; use {@link #isEnded()} to tell them apart. */
  T poll(long timeout, TimeUnit unit) throws InterruptedException {
    Object item = queue.poll(timeout, unit);
    return item == null ? null : unwrap(item);
  }

  /** Signals that one producer is done. */
  void close() throws InterruptedException {
    if (openProducers.decrementAndGet() == 0) {
      queue.put(END);
    }
  }

  boolean isEnded() {
    return ended;
  }

  String name() {
    return name;
  }

  @SuppressWarnings("unchecked")
  private T unwrap(Object item) throws InterruptedException {
    if (item == END) {
      ended = true;
      // leave the marker for the next consumer; no producer can fill the freed slot any more
      queue.put(END);
      return null;
    }
    return (T) item;
  }
}
