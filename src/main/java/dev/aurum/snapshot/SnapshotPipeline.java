package dev.aurum.snapshot;

import dev.aurum.config.AurumProperties;
import dev.aurum.layout.FileTrees;
import dev.aurum.layout.GoldenRepoLayout;
import dev.aurum.layout.VersionDirectories;
import dev.aurum.process.CommandResult;
import dev.aurum.process.CommandRunner;
import dev.aurum.process.CommandTimeoutException;
import dev.aurum.registry.GoldenRepo;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Indexes a golden repo's source in place and turns it into an immutable versioned snapshot.
 *
 * <p>The source is indexed once. {@link #createSnapshot} then copies it with {@code cp
 * --reflink=auto -a}, so the snapshot inherits the index without re-indexing, and rewrites the
 * indexer configuration for the new location with {@code fix-config}. {@code fix-config} only ever
 * runs inside the snapshot, never in the source.
 */
@Service
public class SnapshotPipeline {

  private static final Logger log = LoggerFactory.getLogger(SnapshotPipeline.class);

  static final long MAX_NAME_WAIT_SECONDS = 5;

  private final CommandRunner commandRunner;
  private final GoldenRepoLayout layout;
  private final RepositoryHealthCheck healthCheck;
  private final Clock clock;
  private final AurumProperties.Indexer indexer;
  private final Duration gitTimeout;
  private final Sleeper sleeper;

  @Autowired
  public SnapshotPipeline(
      CommandRunner commandRunner,
      GoldenRepoLayout layout,
      RepositoryHealthCheck healthCheck,
      Clock clock,
      AurumProperties properties) {
    this(
        commandRunner,
        layout,
        healthCheck,
        clock,
        properties,
        duration -> Thread.sleep(duration.toMillis()));
  }

  SnapshotPipeline(
      CommandRunner commandRunner,
      GoldenRepoLayout layout,
      RepositoryHealthCheck healthCheck,
      Clock clock,
      AurumProperties properties,
      Sleeper sleeper) {
    this.sleeper = sleeper;
    this.commandRunner = commandRunner;
    this.layout = layout;
    this.healthCheck = healthCheck;
    this.clock = clock;
    this.indexer = properties.getIndexer();
    this.gitTimeout = properties.getGit().getCommandTimeout();
  }

  /**
   * Builds the configured indexes with the source path as working directory.
   *
   * <p>Always runs {@code index --fts}. Temporal indexing runs only for git repos with {@code
   * enable_temporal}; local repos have no history and skip it with a warning. SCIP runs when
   * {@code enable_scip} is set.
   *
   * @throws IndexingException if any indexer step fails or times out
   */
  public void indexSource(GoldenRepo repo, Path sourcePath) {
    String alias = repo.getAlias();
    runIndexer(alias, sourcePath, List.of("index", "--fts"), indexer.getIndexTimeout(), "index");

    if (repo.isEnableTemporal()) {
      if (repo.isGit()) {
        runIndexer(
            alias, sourcePath, temporalArguments(repo), indexer.getTemporalTimeout(), "temporal");
      } else {
        log.warn("Skipping temporal indexing for local repo {} (no git history)", alias);
      }
    }

    if (repo.isEnableScip()) {
      runIndexer(alias, sourcePath, List.of("scip", "generate"), indexer.getScipTimeout(), "scip");
    }
  }

  /**
   * Copies the indexed source into a new {@code .versioned/<alias>/v_<ts>} directory and makes it
   * self-consistent.
   *
   * @return absolute path of the new snapshot
   * @throws SnapshotException if any step fails; only the new snapshot directory is removed
   */
  public Path createSnapshot(String alias, Path sourcePath) {
    Path versionedDir = layout.versionedDir(alias);
    Path target;
    try {
      Files.createDirectories(versionedDir);
      target = nextFreeSnapshotPath(versionedDir);
    } catch (IOException e) {
      throw new SnapshotException("Cannot prepare " + versionedDir + " for " + alias, e);
    }

    try {
      copy(sourcePath, target);
      if (Files.exists(target.resolve(".git"))) {
        repairGitState(alias, target);
      }
      fixConfig(alias, target);
      validate(target);
      log.info(
          "Snapshot {} created for {} with indexes {}",
          target.getFileName(),
          alias,
          IndexArtifacts.detect(target).present());
      return target;
    } catch (RuntimeException e) {
      log.error("Snapshot creation failed for {}, removing {}", alias, target, e);
      removePartial(target);
      if (e instanceof SnapshotException snapshotException) {
        throw snapshotException;
      }
      throw new SnapshotException("Failed to create snapshot for " + alias, e);
    }
  }

  /**
   * Names the snapshot after the current second. A snapshot name must never be ahead of the clock:
   * the local change detector compares file mtimes against it, and edits made during a second
   * already claimed by a later name would go unnoticed. When the current second is taken, waits
   * for the next one.
   */
  private Path nextFreeSnapshotPath(Path versionedDir) {
    long now = clock.instant().getEpochSecond();
    OptionalLong latest = VersionDirectories.latestTimestamp(versionedDir);
    if (latest.isPresent() && now <= latest.getAsLong()) {
      now = awaitSecondAfter(latest.getAsLong(), now);
    }
    return versionedDir.resolve(VersionDirectories.nameFor(now));
  }

  private long awaitSecondAfter(long taken, long now) {
    if (taken + 1 - now > MAX_NAME_WAIT_SECONDS) {
      throw new SnapshotException(
          "Latest snapshot v_" + taken + " is ahead of the clock (now " + now + ")");
    }
    log.debug("Snapshot v_{} already exists, waiting for the next second", taken);
    long current = now;
    for (long attempt = 0; current <= taken; attempt++) {
      if (attempt > MAX_NAME_WAIT_SECONDS) {
        throw new SnapshotException("Clock did not advance past snapshot v_" + taken);
      }
      try {
        sleeper.sleep(Duration.ofMillis(1000 - clock.millis() % 1000));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SnapshotException("Interrupted while waiting to name snapshot", e);
      }
      current = clock.instant().getEpochSecond();
    }
    return current;
  }

  private void copy(Path sourcePath, Path target) {
    List<String> command =
        List.of("cp", "--reflink=auto", "-a", sourcePath.toString(), target.toString());
    CommandResult result;
    try {
      result = commandRunner.run(command, null, indexer.getCopyTimeout());
    } catch (CommandTimeoutException e) {
      throw new SnapshotException("Copy of " + sourcePath + " timed out", e);
    }
    if (!result.isSuccess() || !Files.isDirectory(target)) {
      throw new SnapshotException(
          "Copy of " + sourcePath + " to " + target + " failed: " + result.stderr().strip());
    }
  }

  // The copy changes file timestamps, which git reports as modifications until the index is
  // refreshed.
  private void repairGitState(String alias, Path target) {
    runNonFatal(alias, target, List.of("git", "update-index", "--refresh"));
    runNonFatal(alias, target, List.of("git", "restore", "."));
  }

  private void runNonFatal(String alias, Path target, List<String> command) {
    try {
      CommandResult result = commandRunner.run(command, target, gitTimeout);
      if (!result.isSuccess()) {
        log.debug(
            "'{}' exited {} for {}: {}",
            String.join(" ", command),
            result.exitCode(),
            alias,
            result.stderr().strip());
      }
    } catch (CommandTimeoutException e) {
      log.warn("'{}' timed out for {}", String.join(" ", command), alias);
    }
  }

  private void fixConfig(String alias, Path target) {
    List<String> command = indexerCommand(List.of("fix-config", "--force"));
    CommandResult result;
    try {
      result = commandRunner.run(command, target, indexer.getFixConfigTimeout());
    } catch (CommandTimeoutException e) {
      throw new SnapshotException("fix-config timed out for " + alias, e);
    }
    if (!result.isSuccess()) {
      throw new SnapshotException(
          "fix-config failed for " + alias + ": " + result.stderr().strip());
    }
  }

  private void validate(Path target) {
    Path index = target.resolve(IndexArtifacts.CODE_INDEXER_DIR).resolve(IndexArtifacts.INDEX_DIR);
    if (!Files.isDirectory(index)) {
      throw new SnapshotException("Index validation failed: " + index + " does not exist");
    }
    if (!healthCheck.isHealthy(target)) {
      throw new SnapshotException("Health check rejected snapshot " + target);
    }
  }

  private void removePartial(Path target) {
    try {
      FileTrees.deleteRecursively(target);
    } catch (IOException e) {
      log.error("Failed to remove partial snapshot {}: {}", target, e.getMessage());
    }
  }

  private List<String> temporalArguments(GoldenRepo repo) {
    List<String> arguments = new ArrayList<>(List.of("index", "--index-commits"));
    if (repo.getTemporalMaxCommits() != null && repo.getTemporalMaxCommits() > 0) {
      arguments.add("--max-commits");
      arguments.add(String.valueOf(repo.getTemporalMaxCommits()));
    }
    if (repo.getTemporalSinceDate() != null && !repo.getTemporalSinceDate().isBlank()) {
      arguments.add("--since-date");
      arguments.add(repo.getTemporalSinceDate());
    }
    return arguments;
  }

  private void runIndexer(
      String alias, Path sourcePath, List<String> arguments, Duration timeout, String step) {
    List<String> command = indexerCommand(arguments);
    log.info("Running '{}' for {} in {}", String.join(" ", command), alias, sourcePath);
    CommandResult result;
    try {
      result = commandRunner.run(command, sourcePath, timeout);
    } catch (CommandTimeoutException e) {
      throw new IndexingException(
          "Indexing (" + step + ") timed out for " + alias + " after " + timeout, e);
    }
    if (!result.isSuccess()) {
      throw new IndexingException(
          "Indexing (" + step + ") failed for " + alias + ": " + result.stderr().strip());
    }
  }

  private List<String> indexerCommand(List<String> arguments) {
    List<String> command = new ArrayList<>();
    command.add(indexer.getCommand());
    command.addAll(arguments);
    return command;
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
