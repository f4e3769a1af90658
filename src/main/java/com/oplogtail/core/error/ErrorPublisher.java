package com.oplogtail.core.error;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.TailError;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous error channel. {@link #publish} never blocks, so a slow error handler cannot stall
 * the data path; errors are delivered in publication order by a dedicated thread.
 */
public class ErrorPublisher implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ErrorPublisher.class);
  private static final TailError END = new TailError();

  private final BlockingQueue<TailError> queue = new LinkedBlockingQueue<>();
  private final Consumer<TailError> handler;
  private final Metrics metrics;
  private final Thread thread;
  private volatile boolean closed;

  public ErrorPublisher(Consumer<TailError> handler, Metrics metrics, String threadName) {
    this.handler = handler;
    this.metrics = metrics;
    this.thread = new Thread(this::run, threadName);
    this.thread.setDaemon(true);
  }

  public void start() {
    thread.start();
  }

  public Thread thread() {
    return thread;
  }

  public void publish(TailError error) {
    if (error.isFatal()) {
      log.error("[ErrorPublisher] {} from {}: {}", error.getErrorType(), error.getSource(), error.getErrorMessage());
    } else {
      log.warn("[ErrorPublisher] {} from {}: {}", error.getErrorType(), error.getSource(), error.getErrorMessage());
    }
    synchronized (queue) {
      if (!closed) {
        queue.add(error);
        return;
      }
    }
    log.error("[ErrorPublisher] Channel closed, error not delivered: {}", error.toJson());
    metrics.inc(MetricKeys.ERROR_FAILED_COUNT);
  }

  private void run() {
    while (true) {
      TailError error;
      try {
        error = queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (error == END) {
        return;
      }
      deliver(error);
    }
  }

  private void deliver(TailError error) {
    if (handler == null) {
      return;
    }
    try {
      handler.accept(error);
      metrics.inc(MetricKeys.ERROR_PUBLISHED_COUNT);
    } catch (Exception e) {
      log.error("[ErrorPublisher] Error handler failed for {}", error.toJson(), e);
      metrics.inc(MetricKeys.ERROR_FAILED_COUNT);
    }
  }

  /** Delivers everything already published, then stops the delivery thread. */
  @Override
  public void close() {
    synchronized (queue) {
      if (closed) {
        return;
      }
      closed = true;
      queue.add(END);
    }
    if (Thread.currentThread() == thread) {
      return;
    }
    try {
      thread.join(TimeUnit.SECONDS.toMillis(30));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
