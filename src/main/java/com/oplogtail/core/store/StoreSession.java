package com.oplogtail.core.store;

/** Scoped store connection handle. */
public interface StoreSession extends AutoCloseable {

  @Override
  void close();
}
