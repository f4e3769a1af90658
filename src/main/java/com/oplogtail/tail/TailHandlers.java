package com.oplogtail.tail;

import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.Value;

/**
 * Per-kind callbacks. Any callback may be left unset; operations of that kind are then discarded
 * without an error.
 */
@Value
@Builder
public class TailHandlers {

  Consumer<Operation> onInsert;
  Consumer<Operation> onUpdate;
  Consumer<Operation> onDelete;
  Consumer<Operation> onDrop;
  Consumer<TailError> onError;
  Sanitizer sanitizer;

  public static TailHandlers of(TailEventHandler handler) {
    return of(handler, null);
  }

  public static TailHandlers of(TailEventHandler handler, Sanitizer sanitizer) {
    if (handler == null) {
      throw new IllegalArgumentException("handler must not be null");
    }
    return TailHandlers.builder()
        .onInsert(handler::onInsert)
        .onUpdate(handler::onUpdate)
        .onDelete(handler::onDelete)
        .onDrop(handler::onDrop)
        .onError(handler::onError)
        .sanitizer(sanitizer)
        .build();
  }

  Consumer<Operation> forOperation(Operation operation) {
    switch (operation.getKind()) {
      case INSERT:
        return onInsert;
      case UPDATE:
        return onUpdate;
      case DELETE:
        return onDelete;
      case DROP:
        return onDrop;
      default:
        return null;
    }
  }
}
