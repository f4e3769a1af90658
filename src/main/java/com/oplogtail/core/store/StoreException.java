package com.oplogtail.core.store;

/** Transient store failure: timeouts, network errors, interrupted cursors. */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
