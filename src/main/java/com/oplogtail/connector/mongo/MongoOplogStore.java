package com.oplogtail.connector.mongo;

import static com.oplogtail.connector.mongo.MongoConfigKeys.*;

import com.mongodb.ConnectionString;
import com.mongodb.CursorType;
import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.oplogtail.core.config.ScopedConfig;
import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import com.oplogtail.core.store.DocumentCursor;
import com.oplogtail.core.store.LogCursor;
import com.oplogtail.core.store.LogHistoryLostException;
import com.oplogtail.core.store.OplogStore;
import com.oplogtail.core.store.RawLogEntry;
import com.oplogtail.core.store.ShardSpec;
import com.oplogtail.core.store.StoreException;
import com.oplogtail.core.store.StoreSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OplogStore} over a replica set's {@code local.oplog.rs}, using the synchronous driver.
 *
 * <p>The log is read with a tailable-await cursor. Direct-read shards split a collection by the
 * hashed {@code _id} modulo the shard count, so shards are disjoint without knowing the key range.
 */
public class MongoOplogStore implements OplogStore {

  private static final Logger log = LoggerFactory.getLogger(MongoOplogStore.class);

  static final String DEFAULT_OPLOG_DB = "local";
  static final String DEFAULT_OPLOG_COLLECTION = "oplog.rs";
  static final Duration DEFAULT_CURSOR_AWAIT = Duration.ofSeconds(1);

  /** CappedPositionLost and ChangeStreamHistoryLost. */
  static final Set<Integer> HISTORY_LOST_CODES = Set.of(136, 286);

  private final ConnectionString connectionString;
  private final MongoClient sharedClient;
  private final String oplogDatabase;
  private final String oplogCollection;
  private final Duration cursorAwait;

  private MongoOplogStore(
      ConnectionString connectionString,
      MongoClient sharedClient,
      String oplogDatabase,
      String oplogCollection,
      Duration cursorAwait) {
    this.connectionString = connectionString;
    this.sharedClient = sharedClient;
    this.oplogDatabase = oplogDatabase;
    this.oplogCollection = oplogCollection;
    this.cursorAwait = cursorAwait;
  }

  /** Each session opens and owns its own client. */
  public MongoOplogStore(String uri) {
    this(new ConnectionString(uri), null, DEFAULT_OPLOG_DB, DEFAULT_OPLOG_COLLECTION, DEFAULT_CURSOR_AWAIT);
  }

  /** Sessions borrow {@code client}; closing a session leaves it open. */
  public MongoOplogStore(MongoClient client, Duration cursorAwait) {
    this(null, client, DEFAULT_OPLOG_DB, DEFAULT_OPLOG_COLLECTION, cursorAwait);
  }

  public static MongoOplogStore fromScopedConfig() {
    return new MongoOplogStore(
        new ConnectionString(ScopedConfig.require(MONGO_URI)),
        null,
        ScopedConfig.getOrDefault(MONGO_OPLOG_DB, DEFAULT_OPLOG_DB),
        ScopedConfig.getOrDefault(MONGO_OPLOG_COLLECTION, DEFAULT_OPLOG_COLLECTION),
        ScopedConfig.getMillis(MONGO_CURSOR_AWAIT_MS, DEFAULT_CURSOR_AWAIT));
  }

  @Override
  public StoreSession openSession() {
    if (sharedClient != null) {
      return new MongoStoreSession(sharedClient, false);
    }
    try {
      MongoClient client = MongoClients.create(connectionString);
      log.info("[MongoCDC] Connected to {}", connectionString.getHosts());
      return new MongoStoreSession(client, true);
    } catch (MongoException e) {
      log.error("[MongoCDC] Failed to connect to {}", connectionString.getHosts(), e);
      throw new StoreException("Failed to connect to MongoDB", e);
    }
  }

  @Override
  public Optional<Document> fetchById(StoreSession session, Namespace namespace, Object id) {
    try {
      return Optional.ofNullable(collection(session, namespace).find(Filters.eq("_id", id)).first());
    } catch (MongoException e) {
      throw new StoreException("Failed to fetch " + id + " from " + namespace, e);
    }
  }

  @Override
  public DocumentCursor scanShard(
      StoreSession session, Namespace namespace, ShardSpec shard, int batchSize, int limit) {
    MongoCollection<Document> collection = collection(session, namespace);
    try {
      MongoCursor<Document> cursor;
      if (shard.isWhole()) {
        FindIterable<Document> find = collection.find().batchSize(batchSize);
        if (limit > 0) {
          find = find.limit(limit);
        }
        cursor = find.cursor();
      } else {
        cursor = collection.aggregate(buildShardPipeline(shard, limit)).batchSize(batchSize).cursor();
      }
      return new MongoDocumentCursor(cursor, namespace);
    } catch (MongoException e) {
      throw new StoreException("Failed to scan shard " + shard + " of " + namespace, e);
    }
  }

  @Override
  public LogCursor openLogCursor(StoreSession session, LogPosition after) {
    MongoCollection<Document> oplog = oplog(session);
    try {
      if (after != null) {
        requireRetained(oplog, after);
      }
      Bson filter = after == null ? new Document() : Filters.gt("ts", after.toTimestamp());
      MongoCursor<Document> cursor =
          oplog
              .find(filter)
              .cursorType(CursorType.TailableAwait)
              .maxAwaitTime(cursorAwait.toMillis(), TimeUnit.MILLISECONDS)
              .noCursorTimeout(true)
              .cursor();
      return new MongoLogCursor(cursor, after);
    } catch (MongoException e) {
      throw translate(e, after);
    }
  }

  @Override
  public Optional<LogPosition> latestPosition(StoreSession session) {
    try {
      Document newest =
          oplog(session)
              .find()
              .projection(Projections.include("ts"))
              .sort(new Document("$natural", -1))
              .limit(1)
              .first();
      return Optional.ofNullable(newest).map(d -> toRawEntry(d).getPosition());
    } catch (MongoException e) {
      throw new StoreException("Failed to read the newest log position", e);
    }
  }

  private void requireRetained(MongoCollection<Document> oplog, LogPosition after) {
    Document oldest =
        oplog
            .find()
            .projection(Projections.include("ts"))
            .sort(new Document("$natural", 1))
            .limit(1)
            .first();
    if (oldest == null) {
      return;
    }
    LogPosition oldestPosition = toRawEntry(oldest).getPosition();
    if (oldestPosition != null && oldestPosition.isAfter(after)) {
      throw new LogHistoryLostException(
          after, "Oldest retained log entry " + oldestPosition + " is after " + after);
    }
  }

  private MongoCollection<Document> oplog(StoreSession session) {
    return mongo(session).client().getDatabase(oplogDatabase).getCollection(oplogCollection);
  }

  private static MongoCollection<Document> collection(StoreSession session, Namespace namespace) {
    if (namespace.isDatabaseLevel()) {
      throw new IllegalArgumentException("Collection namespace required: " + namespace);
    }
    return mongo(session)
        .client()
        .getDatabase(namespace.getDatabase())
        .getCollection(namespace.getCollection());
  }

  private static MongoStoreSession mongo(StoreSession session) {
    if (!(session instanceof MongoStoreSession)) {
      throw new IllegalArgumentException("Not a MongoDB session: " + session);
    }
    return (MongoStoreSession) session;
  }

  static StoreException translate(MongoException e, LogPosition position) {
    if (HISTORY_LOST_CODES.contains(e.getCode())) {
      return new LogHistoryLostException(position, "Log history lost: " + e.getMessage(), e);
    }
    return new StoreException("Log read failed: " + e.getMessage(), e);
  }

  /**
   * Documents whose hashed {@code _id} falls into the shard's residue class.
   *
   * <pre>{@code
   * [{$match: {$expr: {$eq: [{$abs: {$mod: [{$toHashedIndexKey: "$_id"}, count]}}, index]}}},
   *  {$limit: limit}]
   * }</pre>
   */
  static List<Document> buildShardPipeline(ShardSpec shard, int limit) {
    Document hashed = new Document("$toHashedIndexKey", "$_id");
    Document residue =
        new Document("$abs", new Document("$mod", List.of(hashed, (long) shard.getCount())));
    Document match =
        new Document(
            "$match",
            new Document("$expr", new Document("$eq", List.of(residue, (long) shard.getIndex()))));
    List<Document> pipeline = new ArrayList<>();
    pipeline.add(match);
    if (limit > 0) {
      pipeline.add(new Document("$limit", limit));
    }
    return pipeline;
  }

  static RawLogEntry toRawEntry(Document entry) {
    Object ts = entry.get("ts");
    return RawLogEntry.builder()
        .position(ts instanceof BsonTimestamp ? LogPosition.fromTimestamp((BsonTimestamp) ts) : null)
        .op(entry.getString("op"))
        .ns(entry.getString("ns"))
        .object(entry.get("o", Document.class))
        .object2(entry.get("o2", Document.class))
        .build();
  }

  private static final class MongoLogCursor implements LogCursor {

    private final MongoCursor<Document> cursor;
    private LogPosition last;

    MongoLogCursor(MongoCursor<Document> cursor, LogPosition after) {
      this.cursor = cursor;
      this.last = after;
    }

    @Override
    public RawLogEntry tryNext() {
      Document next;
      try {
        next = cursor.tryNext();
      } catch (MongoException e) {
        throw translate(e, last);
      }
      if (next == null) {
        return null;
      }
      RawLogEntry entry = toRawEntry(next);
      last = entry.getPosition();
      return entry;
    }

    @Override
    public void close() {
      cursor.close();
    }
  }

  private static final class MongoDocumentCursor implements DocumentCursor {

    private final MongoCursor<Document> cursor;
    private final Namespace namespace;

    MongoDocumentCursor(MongoCursor<Document> cursor, Namespace namespace) {
      this.cursor = cursor;
      this.namespace = namespace;
    }

    @Override
    public boolean hasNext() {
      try {
        return cursor.hasNext();
      } catch (MongoException e) {
        throw new StoreException("Scan of " + namespace + " failed", e);
      }
    }

    @Override
    public Document next() {
      try {
        return cursor.next();
      } catch (MongoException e) {
        throw new StoreException("Scan of " + namespace + " failed", e);
      }
    }

    @Override
    public void close() {
      cursor.close();
    }
  }
}
