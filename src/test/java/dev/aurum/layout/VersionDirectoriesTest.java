package dev.aurum.layout;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VersionDirectoriesTest {

  @Test
  void parsesWellFormedNames() {
    assertThat(VersionDirectories.parseTimestamp("v_1700000000")).hasValue(1_700_000_000L);
    assertThat(VersionDirectories.parseTimestamp("v_0")).hasValue(0L);
  }

  @Test
  void rejectsMalformedNames() {
    assertThat(VersionDirectories.parseTimestamp("v_")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp("v_abc")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp("v_-5")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp("v_12x")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp("x_12")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp("v_99999999999999999999999")).isEmpty();
    assertThat(VersionDirectories.parseTimestamp(null)).isEmpty();
  }

  @Test
  void latestIsNumericNotLexicographic(@TempDir Path dir) throws IOException {
    Files.createDirectories(dir.resolve("v_999"));
    Files.createDirectories(dir.resolve("v_1000"));
    Files.createDirectories(dir.resolve("v_junk"));
    Files.writeString(dir.resolve("v_5000"), "a file, not a snapshot");

    assertThat(VersionDirectories.latest(dir)).contains(dir.resolve("v_1000"));
    assertThat(VersionDirectories.latestTimestamp(dir)).hasValue(1000L);
  }

  @Test
  void missingDirectoryHasNoLatest(@TempDir Path dir) {
    assertThat(VersionDirectories.latest(dir.resolve("absent"))).isEmpty();
    assertThat(VersionDirectories.latestTimestamp(dir.resolve("absent"))).isEmpty();
  }

  @Test
  void layoutRecognisesOnlyItsOwnSnapshots(@TempDir Path dir) {
    GoldenRepoLayout layout = new GoldenRepoLayout(dir);

    assertThat(layout.isVersionedSnapshotOf("a", layout.versionedDir("a").resolve("v_10")))
        .isTrue();
    assertThat(layout.isVersionedSnapshotOf("a", layout.versionedDir("b").resolve("v_10")))
        .isFalse();
    assertThat(layout.isVersionedSnapshotOf("a", layout.masterClone("a"))).isFalse();
    assertThat(layout.isVersionedSnapshotOf("a", layout.versionedDir("a").resolve("v_x")))
        .isFalse();
  }
}
