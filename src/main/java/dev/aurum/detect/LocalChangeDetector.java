package dev.aurum.detect;

import dev.aurum.layout.GoldenRepoLayout;
import dev.aurum.layout.VersionDirectories;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects changes in a local (non-git) golden repo by comparing file modification times against
 * the timestamp of its latest published snapshot.
 *
 * <p>Only regular files are compared. Directory mtimes move whenever any child is created or
 * removed, hidden ones included, so they are never consulted. Entries whose name starts with
 * {@code .} are ignored at any depth and hidden directories are not descended, so the indexer's
 * own {@code .code-indexer} state never counts as a change.
 */
@Component
public class LocalChangeDetector implements ChangeDetector {

  private static final Logger log = LoggerFactory.getLogger(LocalChangeDetector.class);

  private final GoldenRepoLayout layout;

  public LocalChangeDetector(GoldenRepoLayout layout) {
    this.layout = layout;
  }

  @Override
  public boolean hasChanges(Path sourcePath, String alias) {
    return hasLocalChanges(sourcePath, alias);
  }

  /**
   * Reports whether any visible file under {@code sourcePath} is newer than the latest snapshot.
   *
   * @return true when no snapshot exists yet or a visible file's mtime (whole seconds) is strictly
   *     greater than the latest snapshot timestamp
   */
  public boolean hasLocalChanges(Path sourcePath, String alias) {
    Path versionedDir = layout.versionedDir(alias);
    if (!Files.isDirectory(versionedDir)) {
      log.info("No versioned snapshots for {}, treating as changed", alias);
      return true;
    }

    OptionalLong latest = VersionDirectories.latestTimestamp(versionedDir);
    if (latest.isEmpty()) {
      log.info("No valid snapshot directory for {}, treating as changed", alias);
      return true;
    }

    if (!Files.isDirectory(sourcePath)) {
      log.warn("Source directory {} for {} does not exist", sourcePath, alias);
      return false;
    }

    boolean changed = hasFileNewerThan(sourcePath, latest.getAsLong());
    if (changed) {
      log.info("Local changes detected for {} since v_{}", alias, latest.getAsLong());
    }
    return changed;
  }

  private static boolean hasFileNewerThan(Path root, long epochSeconds) {
    NewerFileVisitor visitor = new NewerFileVisitor(root, epochSeconds);
    try {
      Files.walkFileTree(root, visitor);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + root, e);
    }
    return visitor.found;
  }

  private static boolean isHidden(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().startsWith(".");
  }

  private static final class NewerFileVisitor extends SimpleFileVisitor<Path> {

    private final Path root;
    private final long threshold;
    private boolean found;

    NewerFileVisitor(Path root, long threshold) {
      this.root = root;
      this.threshold = threshold;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (dir.equals(root)) {
        return FileVisitResult.CONTINUE;
      }
      return isHidden(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (isHidden(file) || attrs.isDirectory()) {
        return FileVisitResult.CONTINUE;
      }
      return check(attrs);
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      log.debug("Skipping unreadable entry {}: {}", file, exc.getMessage());
      return FileVisitResult.CONTINUE;
    }

    private FileVisitResult check(BasicFileAttributes attrs) {
      if (attrs.lastModifiedTime().to(TimeUnit.SECONDS) > threshold) {
        found = true;
        return FileVisitResult.TERMINATE;
      }
      return FileVisitResult.CONTINUE;
    }
  }
}
