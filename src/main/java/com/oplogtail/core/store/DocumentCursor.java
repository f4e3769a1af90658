package com.oplogtail.core.store;

import java.util.Iterator;
import org.bson.Document;

public interface DocumentCursor extends Iterator<Document>, AutoCloseable {

  @Override
  void close();
}
