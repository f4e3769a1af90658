package com.oplogtail.core.store;

import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import java.util.Optional;
import org.bson.Document;

/**
 * Read-only access to the source store. Implementations must be safe for concurrent use by the
 * fetch workers and direct-read shards; every call runs inside a session handle owned by the
 * caller.
 */
public interface OplogStore {

  StoreSession openSession();

  /** Current document by {@code _id}, or empty when it no longer exists. */
  Optional<Document> fetchById(StoreSession session, Namespace namespace, Object id);

  /**
   * Lazily scans one shard of a collection.
   *
   * @param batchSize documents per round trip
   * @param limit maximum documents for this shard, {@code 0} for no limit
   */
  DocumentCursor scanShard(
      StoreSession session, Namespace namespace, ShardSpec shard, int batchSize, int limit);

  /**
   * Opens a cursor over log entries strictly after {@code after}.
   *
   * @throws LogHistoryLostException if the log no longer retains {@code after}
   */
  LogCursor openLogCursor(StoreSession session, LogPosition after);

  /** Position of the newest log entry, empty for an empty log. */
  Optional<LogPosition> latestPosition(StoreSession session);
}
