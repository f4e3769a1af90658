package com.oplogtail.tail.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.oplogtail.core.model.LogPosition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilePositionStoreTest {

  @TempDir Path dir;

  @Test
  @DisplayName("load() should be empty before the first save")
  void emptyWithoutFile() throws Exception {
    assertThat(new FilePositionStore(dir.resolve("position.json")).load()).isEmpty();
  }

  @Test
  @DisplayName("save() should create parent directories and replace the previous checkpoint")
  void saveAndReload() throws Exception {
    Path file = dir.resolve("state/position.json");
    FilePositionStore store = new FilePositionStore(file);

    store.save(LogPosition.of(1_700_000_000, 1));
    store.save(LogPosition.of(1_700_000_000, 2));

    assertThat(new FilePositionStore(file).load()).contains(LogPosition.of(1_700_000_000, 2));
    assertThat(Files.readString(file)).contains(LogPosition.of(1_700_000_000, 2).toHexString());
    assertThat(file.resolveSibling("position.json.tmp")).doesNotExist();
  }

  @Test
  @DisplayName("load() should fail on a corrupt checkpoint instead of starting over")
  void corruptFile() throws Exception {
    Path file = dir.resolve("position.json");
    Files.writeString(file, "{ not json");

    assertThatThrownBy(() -> new FilePositionStore(file).load()).isInstanceOf(IOException.class);
  }
}
