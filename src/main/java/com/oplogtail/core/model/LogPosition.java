package com.oplogtail.core.model;

import java.io.Serial;
import java.io.Serializable;
import org.bson.BsonTimestamp;

/**
 * Opaque, totally ordered point in the operation log. Backed by the oplog {@code ts} field, where
 * the upper 32 bits hold seconds and the lower 32 bits an increment.
 */
public final class LogPosition implements Comparable<LogPosition>, Serializable {

  @Serial private static final long serialVersionUID = 1L;

  private final long value;

  private LogPosition(long value) {
    this.value = value;
  }

  public static LogPosition of(long value) {
    return new LogPosition(value);
  }

  public static LogPosition of(int seconds, int increment) {
    return new LogPosition(new BsonTimestamp(seconds, increment).getValue());
  }

  public static LogPosition fromTimestamp(BsonTimestamp timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("timestamp must not be null");
    }
    return new LogPosition(timestamp.getValue());
  }

  public static LogPosition fromHexString(String hexString) {
    if (hexString == null || hexString.isBlank()) {
      throw new IllegalArgumentException("position must not be null or blank");
    }
    try {
      return new LogPosition(Long.parseUnsignedLong(hexString.trim(), 16));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid log position: " + hexString, e);
    }
  }

  public String toHexString() {
    return Long.toHexString(value);
  }

  public BsonTimestamp toTimestamp() {
    return new BsonTimestamp(value);
  }

  public long value() {
    return value;
  }

  public boolean isAfter(LogPosition other) {
    return other == null || compareTo(other) > 0;
  }

  @Override
  public int compareTo(LogPosition other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogPosition)) return false;
    return value == ((LogPosition) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    BsonTimestamp ts = toTimestamp();
    return "LogPosition(" + ts.getTime() + ":" + ts.getInc() + ")";
  }
}
