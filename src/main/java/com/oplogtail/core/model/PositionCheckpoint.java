package com.oplogtail.core.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Persisted form of a {@link LogPosition}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionCheckpoint {

  private String position;
  private Instant updatedAt;

  public static PositionCheckpoint of(LogPosition position) {
    return new PositionCheckpoint(position.toHexString(), Instant.now());
  }

  public LogPosition toPosition() {
    return LogPosition.fromHexString(position);
  }
}
