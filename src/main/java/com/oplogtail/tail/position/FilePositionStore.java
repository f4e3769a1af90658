package com.oplogtail.tail.position;

import com.oplogtail.core.model.LogPosition;
import com.oplogtail.core.model.PositionCheckpoint;
import com.oplogtail.core.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/** Keeps the checkpoint as a small JSON file, replaced atomically on every save. */
public class FilePositionStore implements PositionStore {

  private final Path file;

  public FilePositionStore(Path file) {
    if (file == null) {
      throw new IllegalArgumentException("file must not be null");
    }
    this.file = file;
  }

  @Override
  public Optional<LogPosition> load() throws IOException {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    PositionCheckpoint checkpoint = JsonUtils.readFile(file, PositionCheckpoint.class);
    if (checkpoint == null || checkpoint.getPosition() == null) {
      return Optional.empty();
    }
    return Optional.of(checkpoint.toPosition());
  }

  @Override
  public synchronized void save(LogPosition position) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    JsonUtils.writeFile(tmp, PositionCheckpoint.of(position));
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
