package com.oplogtail.tail;

import static com.oplogtail.core.config.ConfigKeys.*;

import com.oplogtail.core.config.ScopedConfig;
import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.Namespace;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/** Tailing options. Every field is optional; defaults favour low memory over throughput. */
@Value
@Builder(toBuilder = true)
public class TailConfig {

  /** Used for thread names and metric tags. */
  @Builder.Default String name = "oplogtail";

  /** Explicit resume point; overrides any persisted checkpoint. */
  LogPosition resumePosition;

  /** Checkpoint file for the acknowledged position; positions are kept in memory when unset. */
  Path positionFile;

  @Builder.Default List<String> includeNamespaces = List.of();
  @Builder.Default List<String> excludeNamespaces = List.of();

  /** Namespaces to snapshot with a direct read, as {@code db.collection}. */
  @Builder.Default List<String> directReadNamespaces = List.of();

  @Builder.Default int directReadersPerCollection = 1;
  @Builder.Default int directReadBatchSize = 500;

  /** Maximum documents per direct-read shard, {@code 0} reads to exhaustion. */
  @Builder.Default int directReadLimit = 0;

  /** Capacity of every queue between pipeline stages. */
  @Builder.Default int channelSize = 20;

  /** Operations per batch window before a size-triggered flush. */
  @Builder.Default int bufferSize = 50;

  /** Longest time a batch window stays open after its first operation. */
  @Builder.Default Duration bufferDuration = Duration.ofMillis(750);

  @Builder.Default int workerCount = 1;
  @Builder.Default OrderingGuarantee ordering = OrderingGuarantee.ORDERED;

  /** Deliver the raw update delta instead of fetching the full document. */
  @Builder.Default boolean updateDataAsDelta = false;

  public static TailConfig defaults() {
    return TailConfig.builder().build();
  }

  /**
   * Fails fast on a configuration that cannot run.
   *
   * @throws IllegalArgumentException describing the first invalid option
   */
  public TailConfig validate() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be null or blank");
    }
    requirePositive(workerCount, "workerCount");
    requirePositive(channelSize, "channelSize");
    requirePositive(bufferSize, "bufferSize");
    requirePositive(directReadersPerCollection, "directReadersPerCollection");
    requirePositive(directReadBatchSize, "directReadBatchSize");
    if (directReadLimit < 0) {
      throw new IllegalArgumentException("directReadLimit must not be negative");
    }
    if (bufferDuration == null || bufferDuration.isZero() || bufferDuration.isNegative()) {
      throw new IllegalArgumentException("bufferDuration must be positive");
    }
    if (ordering == null) {
      throw new IllegalArgumentException("ordering must not be null");
    }
    namespaceFilter();
    directReadTargets();
    return this;
  }

  NamespaceFilter namespaceFilter() {
    return NamespaceFilter.of(includeNamespaces, excludeNamespaces);
  }

  List<Namespace> directReadTargets() {
    if (directReadNamespaces == null) {
      return List.of();
    }
    return directReadNamespaces.stream()
        .map(
            ns -> {
              Namespace parsed = Namespace.parse(ns.trim());
              if (ns.contains("*")) {
                throw new IllegalArgumentException("Direct read namespace must be concrete: " + ns);
              }
              return parsed;
            })
        .distinct()
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Log operations allowed between the reader and their settlement: the three single-operation
   * queues, the batch queue and one open window per batcher and worker. Results held for
   * re-sequencing count against the same limit.
   */
  int maxInFlightLogOperations() {
    return channelSize * 3 + bufferSize * (channelSize + workerCount + 1);
  }

  boolean hasDirectRead() {
    return directReadNamespaces != null && !directReadNamespaces.isEmpty();
  }

  public static TailConfig fromScopedConfig() {
    TailConfig defaults = defaults();
    TailConfigBuilder builder =
        TailConfig.builder()
            .name(ScopedConfig.getOrDefault(TAIL_NAME, defaults.name))
            .includeNamespaces(list(ScopedConfig.getOrDefault(TAIL_INCLUDE_NS, "")))
            .excludeNamespaces(list(ScopedConfig.getOrDefault(TAIL_EXCLUDE_NS, "")))
            .directReadNamespaces(list(ScopedConfig.getOrDefault(TAIL_DIRECT_READ_NS, "")))
            .directReadersPerCollection(
                ScopedConfig.getInt(TAIL_DIRECT_READERS_PER_COL, defaults.directReadersPerCollection))
            .directReadBatchSize(
                ScopedConfig.getInt(TAIL_DIRECT_READ_BATCH_SIZE, defaults.directReadBatchSize))
            .directReadLimit(ScopedConfig.getInt(TAIL_DIRECT_READ_LIMIT, defaults.directReadLimit))
            .channelSize(ScopedConfig.getInt(TAIL_CHANNEL_SIZE, defaults.channelSize))
            .bufferSize(ScopedConfig.getInt(TAIL_BUFFER_SIZE, defaults.bufferSize))
            .bufferDuration(ScopedConfig.getMillis(TAIL_BUFFER_DURATION_MS, defaults.bufferDuration))
            .workerCount(ScopedConfig.getInt(TAIL_WORKER_COUNT, defaults.workerCount))
            .ordering(
                OrderingGuarantee.valueOf(
                    ScopedConfig.getOrDefault(TAIL_ORDERING, defaults.ordering.name()).toUpperCase()))
            .updateDataAsDelta(
                ScopedConfig.getBoolean(TAIL_UPDATE_DATA_AS_DELTA, defaults.updateDataAsDelta));
    if (ScopedConfig.exists(TAIL_RESUME_POSITION)) {
      builder.resumePosition(LogPosition.fromHexString(ScopedConfig.require(TAIL_RESUME_POSITION)));
    }
    if (ScopedConfig.exists(TAIL_POSITION_FILE)) {
      builder.positionFile(Path.of(ScopedConfig.require(TAIL_POSITION_FILE)));
    }
    return builder.build();
  }

  private static List<String> list(String csv) {
    return Arrays.stream(csv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toUnmodifiableList());
  }

  private static void requirePositive(int value, String field) {
    if (value <= 0) {
      throw new IllegalArgumentException(field + " must be positive");
    }
  }
}
