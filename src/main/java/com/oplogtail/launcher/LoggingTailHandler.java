package com.oplogtail.launcher;

import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;
import com.oplogtail.core.model.TailEvent;
import com.oplogtail.tail.TailEventHandler;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every event as one JSON line to the log. */
public class LoggingTailHandler implements TailEventHandler {

  private static final Logger log = LoggerFactory.getLogger(LoggingTailHandler.class);

  private final AtomicLong delivered = new AtomicLong();

  @Override
  public void onInsert(Operation operation) {
    emit(operation);
  }

  @Override
  public void onUpdate(Operation operation) {
    emit(operation);
  }

  @Override
  public void onDelete(Operation operation) {
    emit(operation);
  }

  @Override
  public void onDrop(Operation operation) {
    emit(operation);
  }

  @Override
  public void onError(TailError error) {
    log.warn("[Tail] error {}", error.toJson());
  }

  public long deliveredCount() {
    return delivered.get();
  }

  private void emit(Operation operation) {
    log.info("[Tail] {}", TailEvent.from(operation).toJson());
    delivered.incrementAndGet();
  }
}
