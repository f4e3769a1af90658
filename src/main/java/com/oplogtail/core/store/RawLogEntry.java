package com.oplogtail.core.store;

import com.oplogtail.core.model.LogPosition;
import lombok.Builder;
import lombok.Value;
import org.bson.Document;

/** One oplog entry as stored: {@code ts}, {@code op}, {@code ns}, {@code o} and {@code o2}. */
@Value
@Builder
public class RawLogEntry {

  LogPosition position;
  String op;
  String ns;
  Document object;
  Document object2;
}
