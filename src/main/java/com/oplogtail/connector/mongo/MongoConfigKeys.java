package com.oplogtail.connector.mongo;

public final class MongoConfigKeys {

  private MongoConfigKeys() {}

  public static final String MONGO_URI = "MONGO_URI";
  public static final String MONGO_OPLOG_DB = "MONGO_OPLOG_DB";
  public static final String MONGO_OPLOG_COLLECTION = "MONGO_OPLOG_COLLECTION";
  public static final String MONGO_CURSOR_AWAIT_MS = "MONGO_CURSOR_AWAIT_MS";
}
