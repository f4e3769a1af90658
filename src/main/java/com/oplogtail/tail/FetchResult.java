package com.oplogtail.tail;

import com.oplogtail.core.model.Operation;
import lombok.Value;

/** Outcome of the fetch stage for one operation. Dropped operations are settled, not dispatched. */
@Value
class FetchResult {

  Operation operation;
  boolean dropped;

  static FetchResult delivered(Operation operation) {
    return new FetchResult(operation, false);
  }

  static FetchResult dropped(Operation operation) {
    return new FetchResult(operation, true);
  }
}
