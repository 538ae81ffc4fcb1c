package dev.aurum.alias;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Persisted mapping from an alias to the directory readers should use.
 *
 * @param alias the golden repo alias
 * @param targetPath absolute path of the bound directory
 * @param updatedAt when the binding was last written
 */
public record AliasBinding(String alias, String targetPath, Instant updatedAt) {

  public Path target() {
    return Path.of(targetPath);
  }
}
