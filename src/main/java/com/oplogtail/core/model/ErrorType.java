package com.oplogtail.core.model;

public enum ErrorType {
  /** Log cursor timeout or network error; the cursor is re-opened once. */
  TRANSIENT,
  /** A document fetch failed; only the affected operation is dropped. */
  FETCH,
  /** A registered handler threw while processing an operation. */
  HANDLER,
  /** The session cannot continue, such as a log rolled past the resume position; it terminates. */
  FATAL,
  /** Left in the pipeline when the session ended abnormally; read again after a restart. */
  UNDELIVERED
}
