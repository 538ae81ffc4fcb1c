package dev.aurum.layout;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTreesTest {

  @Test
  void deletesNestedTree(@TempDir Path dir) throws IOException {
    Path tree = dir.resolve("tree");
    Files.createDirectories(tree.resolve("a/b/c"));
    Files.writeString(tree.resolve("a/b/c/file.txt"), "x");
    Files.writeString(tree.resolve(".hidden"), "y");

    FileTrees.deleteRecursively(tree);

    assertThat(tree).doesNotExist();
  }

  @Test
  void doesNotFollowSymlinks(@TempDir Path dir) throws IOException {
    Path outside = Files.createDirectories(dir.resolve("outside"));
    Files.writeString(outside.resolve("keep.txt"), "keep");
    Path tree = Files.createDirectories(dir.resolve("tree"));
    Files.createSymbolicLink(tree.resolve("link"), outside);

    FileTrees.deleteRecursively(tree);

    assertThat(tree).doesNotExist();
    assertThat(outside.resolve("keep.txt")).exists();
  }

  @Test
  void missingPathIsIgnored(@TempDir Path dir) throws IOException {
    FileTrees.deleteRecursively(dir.resolve("absent"));

    assertThat(dir).exists();
  }
}
