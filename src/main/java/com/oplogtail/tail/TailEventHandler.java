package com.oplogtail.tail;

import com.oplogtail.core.model.Operation;
import com.oplogtail.core.model.TailError;

/** Receiver of every event kind. See {@link TailHandlers} for registering only some kinds. */
public interface TailEventHandler {

  void onInsert(Operation operation);

  void onUpdate(Operation operation);

  void onDelete(Operation operation);

  void onDrop(Operation operation);

  void onError(TailError error);
}
