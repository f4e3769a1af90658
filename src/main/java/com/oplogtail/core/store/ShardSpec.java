package com.oplogtail.core.store;

import lombok.Value;

/** Slice {@code index} of {@code count} equal slices of a collection. */
@Value
public class ShardSpec {

  int index;
  int count;

  public static ShardSpec of(int index, int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("shard count must be positive");
    }
    if (index < 0 || index >= count) {
      throw new IllegalArgumentException("shard index " + index + " out of range for " + count);
    }
    return new ShardSpec(index, count);
  }

  public boolean isWhole() {
    return count == 1;
  }

  @Override
  public String toString() {
    return index + "/" + count;
  }
}
