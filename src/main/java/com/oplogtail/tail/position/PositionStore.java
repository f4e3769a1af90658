package com.oplogtail.tail.position;

import com.oplogtail.core.model.LogPosition;
import java.io.IOException;
import java.util.Optional;

/** Durable home of the last acknowledged log position. */
public interface PositionStore {

  Optional<LogPosition> load() throws IOException;

  void save(LogPosition position) throws IOException;
}
