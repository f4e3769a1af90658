package com.oplogtail.tail;

import com.oplogtail.core.model.Namespace;
import org.bson.Document;

/** Optional transform applied to document bodies before they reach a handler. */
public interface Sanitizer {

  boolean requiresSanitizing(Namespace namespace);

  Document sanitize(Namespace namespace, Document body);
}
