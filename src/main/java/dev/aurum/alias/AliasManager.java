package dev.aurum.alias;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aurum.cleanup.QueryLease;
import dev.aurum.cleanup.QueryTracker;
import dev.aurum.layout.GoldenRepoLayout;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the alias binding files under {@code <root>/aliases/}.
 *
 * <p>Every write goes to a temporary file in the same directory, is fsynced, and then atomically
 * renamed over the binding file, so a reader sees either the old binding or the new one.
 */
@Component
public class AliasManager {

  private static final Logger log = LoggerFactory.getLogger(AliasManager.class);

  private final GoldenRepoLayout layout;
  private final ObjectMapper objectMapper;
  private final QueryTracker queryTracker;
  private final Clock clock;

  public AliasManager(
      GoldenRepoLayout layout, ObjectMapper objectMapper, QueryTracker queryTracker, Clock clock) {
    this.layout = layout;
    this.objectMapper = objectMapper;
    this.queryTracker = queryTracker;
    this.clock = clock;
  }

  /**
   * Creates the binding for a new alias.
   *
   * @throws IllegalStateException if the alias is already bound
   * @throws PublishException if the binding cannot be written
   */
  public AliasBinding createAlias(String alias, Path targetPath) {
    if (Files.exists(layout.aliasFile(alias))) {
      throw new IllegalStateException("Alias already exists: " + alias);
    }
    AliasBinding binding = write(alias, targetPath);
    log.info("Created alias {} -> {}", alias, binding.targetPath());
    return binding;
  }

  /** Reads the current binding, or empty if the alias is unknown or its file is unreadable. */
  public Optional<AliasBinding> readAlias(String alias) {
    Path file = layout.aliasFile(alias);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), AliasBinding.class));
    } catch (IOException e) {
      log.error("Failed to read alias file {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Atomically points {@code alias} at {@code newPath}.
   *
   * @return the binding that was previously active, if any
   * @throws PublishException if {@code newPath} is not a directory or the write fails; the old
   *     binding is left untouched
   */
  public Optional<AliasBinding> swapAlias(String alias, Path newPath) {
    if (!Files.isDirectory(newPath)) {
      throw new PublishException("Cannot bind " + alias + " to missing directory " + newPath);
    }
    Optional<AliasBinding> previous = readAlias(alias);
    AliasBinding binding = write(alias, newPath);
    log.info(
        "Swapped alias {}: {} -> {}",
        alias,
        previous.map(AliasBinding::targetPath).orElse("<none>"),
        binding.targetPath());
    return previous;
  }

  /**
   * Removes the binding file.
   *
   * @return true if a binding existed
   */
  public boolean deleteAlias(String alias) {
    try {
      boolean deleted = Files.deleteIfExists(layout.aliasFile(alias));
      if (deleted) {
        log.info("Deleted alias {}", alias);
      }
      return deleted;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete alias " + alias, e);
    }
  }

  /** Resolves the directory an alias currently points to. */
  public Optional<Path> getActualRepoPath(String alias) {
    return readAlias(alias).map(AliasBinding::target);
  }

  /**
   * Resolves the alias and holds a query reference on the bound directory until the lease is
   * closed, so the directory cannot be reclaimed mid-query.
   */
  public Optional<QueryLease> openRead(String alias) {
    return getActualRepoPath(alias).map(queryTracker::track);
  }

  private AliasBinding write(String alias, Path targetPath) {
    AliasBinding binding =
        new AliasBinding(
            alias, targetPath.toAbsolutePath().normalize().toString(), clock.instant());
    Path file = layout.aliasFile(alias);
    Path tmp = null;
    try {
      Files.createDirectories(file.getParent());
      tmp = Files.createTempFile(file.getParent(), "." + alias + "-", ".tmp");
      Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(binding));
      try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
        channel.force(true);
      }
      moveIntoPlace(tmp, file);
      return binding;
    } catch (IOException e) {
      deleteTemp(tmp);
      throw new PublishException("Failed to write alias binding for " + alias, e);
    }
  }

  private static void moveIntoPlace(Path tmp, Path file) throws IOException {
    try {
      Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic move not supported for {}, falling back to replace", file);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteTemp(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not remove temporary alias file {}: {}", tmp, e.getMessage());
    }
  }
}
