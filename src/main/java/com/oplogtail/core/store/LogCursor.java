package com.oplogtail.core.store;

/** Non-restartable cursor over the operation log, in log order. */
public interface LogCursor extends AutoCloseable {

  /**
   * Returns the next entry, or {@code null} if none arrived within the cursor's await time.
   *
   * @throws StoreException on a read failure; the cursor is unusable afterwards
   */
  RawLogEntry tryNext();

  @Override
  void close();
}
