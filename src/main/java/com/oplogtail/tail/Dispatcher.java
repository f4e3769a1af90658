package com.oplogtail.tail;

import com.oplogtail.core.config.MetricKeys;
import com.oplogtail.core.error.ErrorPublisher;
import com.oplogtail.core.metric.Metrics;
import com.oplogtail.core.model.ErrorType;
import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;
import java.util.function.Consumer;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers finalized operations to the registered handlers on a single thread. Handler calls are
 * synchronous, so a slow handler holds back every upstream stage.
 *
 * <p>A handler that throws an {@link Error} ends the session: the failure is reported as fatal and
 * the rest of the queue is drained and reported as undelivered, without settling, so the stored
 * position stays before the first operation that was not delivered.
 */
class Dispatcher implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
  private static final String SOURCE = "Dispatcher";

  private final StageQueue<Operation> dispatch;
  private final NamespaceFilter filter;
  private final TailHandlers handlers;
  private final SettlementListener settlement;
  private final ErrorPublisher errors;
  private final Metrics metrics;
  private final Runnable onFatal;

  Dispatcher(
      StageQueue<Operation> dispatch,
      NamespaceFilter filter,
      TailHandlers handlers,
      SettlementListener settlement,
      ErrorPublisher errors,
      Metrics metrics,
      Runnable onFatal) {
    this.dispatch = dispatch;
    this.filter = filter;
    this.handlers = handlers;
    this.settlement = settlement;
    this.errors = errors;
    this.metrics = metrics;
    this.onFatal = onFatal;
  }

  @Override
  public void run() {
    try {
      Operation op;
      while ((op = dispatch.take()) != null) {
        try {
          dispatch(op);
        } catch (Error e) {
          abort(op, e);
          return;
        }
      }
      log.debug("[Dispatcher] Dispatch queue ended");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[Dispatcher] Interrupted before the dispatch queue ended");
    }
  }

  void dispatch(Operation op) {
    deliver(op);
    settlement.settled(op);
  }

  private void abort(Operation failed, Error cause) throws InterruptedException {
    log.error("[Dispatcher] Handler failed fatally on {}, stopping", failed, cause);
    metrics.inc(MetricKeys.HANDLER_ERROR_COUNT);
    errors.publish(
        TailError.of(ErrorType.FATAL, SOURCE, "Handler failed fatally for " + failed, failed, cause));
    onFatal.run();

    long undelivered = 0;
    Operation op;
    while ((op = dispatch.take()) != null) {
      errors.publish(
          TailError.of(
              ErrorType.UNDELIVERED, SOURCE, "Not delivered after a fatal handler failure", op, null));
      undelivered++;
    }
    log.warn("[Dispatcher] {} operations reported as undelivered", undelivered);
  }

  private void deliver(Operation op) {
    if (!filter.test(op.getNamespace())) {
      metrics.inc(MetricKeys.FILTER_DROP_COUNT);
      return;
    }
    metrics.inc(MetricKeys.FILTER_PASS_COUNT);

    Consumer<Operation> handler = handlers.forOperation(op);
    if (handler == null) {
      metrics.inc(MetricKeys.DISPATCH_DISCARD_COUNT);
      log.trace("[Dispatcher] No handler for {}, discarded", op.getKind());
      return;
    }

    try {
      handler.accept(sanitize(op));
      metrics.inc(countKey(op));
    } catch (RuntimeException e) {
      metrics.inc(MetricKeys.HANDLER_ERROR_COUNT);
      errors.publish(
          TailError.of(ErrorType.HANDLER, SOURCE, "Handler failed for " + op, op, e));
    }
  }

  private Operation sanitize(Operation op) {
    Sanitizer sanitizer = handlers.getSanitizer();
    if (sanitizer == null || op.getBody() == null || !sanitizer.requiresSanitizing(op.getNamespace())) {
      return op;
    }
    Document sanitized = sanitizer.sanitize(op.getNamespace(), op.getBody());
    return op.toBuilder().body(sanitized).build();
  }

  private static String countKey(Operation op) {
    switch (op.getKind()) {
      case INSERT:
        return MetricKeys.DISPATCH_INSERT_COUNT;
      case UPDATE:
        return MetricKeys.DISPATCH_UPDATE_COUNT;
      case DELETE:
        return MetricKeys.DISPATCH_DELETE_COUNT;
      default:
        return MetricKeys.DISPATCH_DROP_COUNT;
    }
  }
}
