package dev.aurum.layout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Static utility for {@code v_<unix_seconds>} snapshot directory names. Names that do not parse
 * as {@code v_} followed by a non-negative integer are ignored everywhere.
 */
public final class VersionDirectories {

  public static final String PREFIX = "v_";

  private VersionDirectories() {
    // utility class
  }

  public static String nameFor(long epochSeconds) {
    return PREFIX + epochSeconds;
  }

  /**
   * Parses the timestamp out of a snapshot directory name.
   *
   * @return the timestamp, or empty for malformed names such as {@code v_abc} or {@code v_}
   */
  public static OptionalLong parseTimestamp(String name) {
    if (name == null || !name.startsWith(PREFIX) || name.length() == PREFIX.length()) {
      return OptionalLong.empty();
    }
    String digits = name.substring(PREFIX.length());
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return OptionalLong.empty();
      }
    }
    try {
      return OptionalLong.of(Long.parseLong(digits));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  /**
   * Finds the numerically latest snapshot timestamp directly under {@code versionedDir}.
   *
   * @return the timestamp, or empty if the directory is missing or holds no valid snapshot
   */
  public static OptionalLong latestTimestamp(Path versionedDir) {
    Optional<Path> latest = latest(versionedDir);
    return latest.isPresent()
        ? parseTimestamp(latest.get().getFileName().toString())
        : OptionalLong.empty();
  }

  /** Returns the path of the numerically latest valid snapshot directory, if any. */
  public static Optional<Path> latest(Path versionedDir) {
    if (!Files.isDirectory(versionedDir)) {
      return Optional.empty();
    }
    Path best = null;
    long bestTs = -1;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(versionedDir)) {
      for (Path entry : entries) {
        if (!Files.isDirectory(entry)) {
          continue;
        }
        OptionalLong ts = parseTimestamp(entry.getFileName().toString());
        if (ts.isPresent() && ts.getAsLong() > bestTs) {
          bestTs = ts.getAsLong();
          best = entry;
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + versionedDir, e);
    }
    return Optional.ofNullable(best);
  }
}
