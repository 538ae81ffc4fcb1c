package dev.aurum.layout;

import dev.aurum.config.AurumProperties;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves the on-disk locations under the golden repos root.
 *
 * <pre>
 * &lt;root&gt;/&lt;alias&gt;/                    flat master clone
 * &lt;root&gt;/.versioned/&lt;alias&gt;/v_&lt;ts&gt;/  published snapshots
 * &lt;root&gt;/aliases/&lt;alias&gt;.json         alias bindings
 * &lt;root&gt;/.locks/&lt;alias&gt;.lock          external write locks
 * </pre>
 */
@Component
public class GoldenRepoLayout {

  public static final String VERSIONED_DIR = ".versioned";
  public static final String ALIASES_DIR = "aliases";
  public static final String LOCKS_DIR = ".locks";

  private final Path root;

  @Autowired
  public GoldenRepoLayout(AurumProperties properties) {
    this(properties.getGoldenReposDir());
  }

  public GoldenRepoLayout(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  public Path masterClone(String alias) {
    return root.resolve(alias);
  }

  public Path versionedDir(String alias) {
    return root.resolve(VERSIONED_DIR).resolve(alias);
  }

  public Path aliasesDir() {
    return root.resolve(ALIASES_DIR);
  }

  public Path aliasFile(String alias) {
    return aliasesDir().resolve(alias + ".json");
  }

  public Path locksDir() {
    return root.resolve(LOCKS_DIR);
  }

  public Path lockFile(String alias) {
    return locksDir().resolve(alias + ".lock");
  }

  /** True when {@code path} is a direct {@code v_<ts>} child of this alias's versioned dir. */
  public boolean isVersionedSnapshotOf(String alias, Path path) {
    Path normalized = path.toAbsolutePath().normalize();
    return versionedDir(alias).equals(normalized.getParent())
        && VersionDirectories.parseTimestamp(normalized.getFileName().toString()).isPresent();
  }
}
