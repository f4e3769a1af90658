package com.oplogtail.connector.mongo;

import com.mongodb.client.MongoClient;
import com.oplogtail.core.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client connection scoped to one tailing session. Clients handed in by the caller are shared and
 * left open on close.
 */
class MongoStoreSession implements StoreSession {

  private static final Logger log = LoggerFactory.getLogger(MongoStoreSession.class);

  private final MongoClient client;
  private final boolean owned;
  private volatile boolean closed;

  MongoStoreSession(MongoClient client, boolean owned) {
    this.client = client;
    this.owned = owned;
  }

  MongoClient client() {
    if (closed) {
      throw new IllegalStateException("Store session already closed");
    }
    return client;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (owned) {
      client.close();
      log.info("[MongoCDC] Client closed");
    }
  }
}
