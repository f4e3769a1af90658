package com.oplogtail.core.store;

import com.oplogtail.core.model.LogPosition;
import lombok.Getter;

/** The log has rolled over past the requested position; tailing cannot resume from it. */
public class LogHistoryLostException extends StoreException {

  @Getter private final LogPosition requested;

  public LogHistoryLostException(LogPosition requested, String message) {
    super(message);
    this.requested = requested;
  }

  public LogHistoryLostException(LogPosition requested, String message, Throwable cause) {
    super(message, cause);
    this.requested = requested;
  }
}
