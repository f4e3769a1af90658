package com.oplogtail.tail.position;

import com.oplogtail.core.model.LogPosition;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryPositionStore implements PositionStore {

  private final AtomicReference<LogPosition> position = new AtomicReference<>();

  public InMemoryPositionStore() {}

  public InMemoryPositionStore(LogPosition initial) {
    position.set(initial);
  }

  @Override
  public Optional<LogPosition> load() {
    return Optional.ofNullable(position.get());
  }

  @Override
  public void save(LogPosition position) {
    this.position.set(position);
  }
}
