package dev.aurum.refresh;

import dev.aurum.alias.AliasBinding;
import dev.aurum.alias.AliasManager;
import dev.aurum.alias.PublishException;
import dev.aurum.cleanup.CleanupManager;
import dev.aurum.config.AurumProperties;
import dev.aurum.detect.GitChangeDetector;
import dev.aurum.detect.LocalChangeDetector;
import dev.aurum.git.GitFetchException;
import dev.aurum.git.GitUpdater;
import dev.aurum.layout.FileTrees;
import dev.aurum.layout.GoldenRepoLayout;
import dev.aurum.lock.WriteLockManager;
import dev.aurum.registry.GoldenRepo;
import dev.aurum.registry.GoldenRepoRegistry;
import dev.aurum.snapshot.SnapshotPipeline;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Keeps every registered golden repo in sync with its upstream.
 *
 * <p>The dispatch loop runs on the {@code loopScheduler} every {@code aurum.refresh.interval} and
 * submits one refresh per registered alias to the bounded {@code refreshWorkers} pool. Aliases
 * whose previous refresh is still running are skipped, and {@link #executeRefresh} additionally
 * serializes on a per-alias lock, so refreshes of the same alias never overlap while different
 * aliases proceed in parallel.
 *
 * <p>A refresh that finds changes indexes the source in place, snapshots it into a new versioned
 * directory, atomically rebinds the alias and queues the superseded snapshot for cleanup. Failed
 * fetches feed the auto-recovery state machine: corruption triggers an immediate re-clone of the
 * master clone, transient failures only after {@code aurum.refresh.reclone-threshold} consecutive
 * failures, and never more often than {@code aurum.refresh.reclone-cooldown}.
 */
@Service
public class RefreshScheduler implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

  private final GoldenRepoRegistry registry;
  private final AliasManager aliasManager;
  private final GitChangeDetector gitChangeDetector;
  private final LocalChangeDetector localChangeDetector;
  private final GitUpdater gitUpdater;
  private final SnapshotPipeline snapshotPipeline;
  private final CleanupManager cleanupManager;
  private final WriteLockManager writeLockManager;
  private final RefreshProgressTracker progressTracker;
  private final GoldenRepoLayout layout;
  private final TaskExecutor workers;
  private final TaskScheduler loopScheduler;
  private final Clock clock;

  private final FailureTracker failureTracker;
  private final RecoveryPolicy recoveryPolicy;
  private final Duration interval;
  private final Duration recloneCooldown;

  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final ConcurrentHashMap<String, ReentrantLock> aliasLocks = new ConcurrentHashMap<>();

  private volatile @Nullable ScheduledFuture<?> loop;

  public RefreshScheduler(
      GoldenRepoRegistry registry,
      AliasManager aliasManager,
      GitChangeDetector gitChangeDetector,
      LocalChangeDetector localChangeDetector,
      GitUpdater gitUpdater,
      SnapshotPipeline snapshotPipeline,
      CleanupManager cleanupManager,
      WriteLockManager writeLockManager,
      RefreshProgressTracker progressTracker,
      GoldenRepoLayout layout,
      @Qualifier("refreshWorkers") TaskExecutor workers,
      @Qualifier("loopScheduler") TaskScheduler loopScheduler,
      AurumProperties properties,
      Clock clock) {
    this.registry = registry;
    this.aliasManager = aliasManager;
    this.gitChangeDetector = gitChangeDetector;
    this.localChangeDetector = localChangeDetector;
    this.gitUpdater = gitUpdater;
    this.snapshotPipeline = snapshotPipeline;
    this.cleanupManager = cleanupManager;
    this.writeLockManager = writeLockManager;
    this.progressTracker = progressTracker;
    this.layout = layout;
    this.workers = workers;
    this.loopScheduler = loopScheduler;
    this.clock = clock;
    this.failureTracker = new FailureTracker(clock);
    this.recoveryPolicy = new RecoveryPolicy(properties.getRefresh().getRecloneThreshold());
    this.interval = properties.getRefresh().getInterval();
    this.recloneCooldown = properties.getRefresh().getRecloneCooldown();
  }

  // --- lifecycle ---

  @Override
  public synchronized void start() {
    if (loop != null) {
      return;
    }
    loop = loopScheduler.scheduleWithFixedDelay(this::runDispatchCycleSafely, interval);
    log.info("Refresh scheduler started (interval {})", interval);
  }

  /**
   * Stops dispatching. Refreshes already running are left to the {@code refreshWorkers} pool, which
   * waits up to {@code aurum.refresh.shutdown-timeout} for them when the context closes.
   */
  @Override
  public synchronized void stop() {
    ScheduledFuture<?> future = loop;
    if (future == null) {
      return;
    }
    loop = null;
    future.cancel(false);
    if (inFlight.isEmpty()) {
      log.info("Refresh scheduler stopped");
    } else {
      log.info("Refresh scheduler stopped with refreshes still running: {}", inFlight);
    }
  }

  @Override
  public boolean isRunning() {
    return loop != null;
  }

  // --- dispatch ---

  /**
   * Submits a refresh for every registered alias. Git and local aliases are treated alike.
   *
   * @return number of refreshes submitted (aliases already in flight are not counted)
   */
  public int runDispatchCycle() {
    List<String> aliases = registry.listAliases();
    int submitted = 0;
    for (String alias : aliases) {
      if (submit(alias, false)) {
        submitted++;
      }
    }
    log.debug("Dispatch cycle submitted {} of {} alias(es)", submitted, aliases.size());
    return submitted;
  }

  /**
   * Submits a manual refresh to the worker pool.
   *
   * @param forceReset for git repos, skip change detection and hard-reset the master clone to the
   *     remote branch before indexing
   * @return false if a refresh of this alias is already running or the pool rejected the task
   */
  public boolean triggerRefresh(String alias, boolean forceReset) {
    log.info("Manual refresh requested for {} (forceReset={})", alias, forceReset);
    return submit(alias, forceReset);
  }

  private boolean submit(String alias, boolean forceReset) {
    if (!inFlight.add(alias)) {
      log.debug("Refresh of {} already in flight, skipping", alias);
      return false;
    }
    try {
      workers.execute(
          () -> {
            try {
              executeRefresh(alias, forceReset);
            } finally {
              inFlight.remove(alias);
            }
          });
      return true;
    } catch (TaskRejectedException e) {
      inFlight.remove(alias);
      log.warn("Refresh of {} rejected by worker pool: {}", alias, e.getMessage());
      return false;
    }
  }

  private void runDispatchCycleSafely() {
    try {
      runDispatchCycle();
    } catch (RuntimeException e) {
      log.error("Error in refresh dispatch cycle", e);
    }
  }

  // --- refresh ---

  /** Runs one refresh cycle for {@code alias} on the calling thread. Never throws. */
  public RefreshResult executeRefresh(String alias) {
    return executeRefresh(alias, false);
  }

  /**
   * Runs one refresh cycle for {@code alias} on the calling thread.
   *
   * @param forceReset see {@link #triggerRefresh(String, boolean)}
   * @return the outcome; failures are reported here, never thrown
   */
  public RefreshResult executeRefresh(String alias, boolean forceReset) {
    ReentrantLock lock = aliasLocks.computeIfAbsent(alias, a -> new ReentrantLock());
    lock.lock();
    try {
      return refresh(alias, forceReset);
    } catch (RuntimeException e) {
      log.error("Unexpected error refreshing {}", alias, e);
      return RefreshResult.failed(alias, "Refresh failed: " + e.getMessage(), false);
    } finally {
      lock.unlock();
    }
  }

  private RefreshResult refresh(String alias, boolean forceReset) {
    Optional<AliasBinding> binding = aliasManager.readAlias(alias);
    if (binding.isEmpty()) {
      log.warn("Alias {} not found, skipping refresh", alias);
      return RefreshResult.skipped(alias, "Alias not found, skipped");
    }
    Optional<GoldenRepo> record = registry.find(alias);
    if (record.isEmpty()) {
      log.warn("Repo {} not in registry, skipping refresh", alias);
      return RefreshResult.skipped(alias, "Repo not in registry, skipped");
    }
    if (writeLockManager.isLocked(alias)) {
      log.info("Skipping refresh of {}, write lock held by external writer", alias);
      return RefreshResult.skipped(alias, "Skipped, write lock held");
    }

    GoldenRepo repo = record.get();
    Path previousTarget = binding.get().target();
    log.info("Starting refresh of {} ({})", alias, repo.getSourceKind());
    progressTracker.start(alias);
    registry.markRefreshing(alias);

    try {
      Path sourcePath = repo.isGit() ? layout.masterClone(alias) : Path.of(repo.getUpstream());
      if (!detectAndUpdate(repo, sourcePath, forceReset)) {
        failureTracker.reset(alias);
        registry.recordSuccess(alias, null);
        progressTracker.complete(alias, RefreshStage.NO_CHANGE, "No changes detected");
        log.info("No changes detected for {}", alias);
        return RefreshResult.noChanges(alias);
      }

      progressTracker.advance(alias, RefreshStage.INDEXING);
      snapshotPipeline.indexSource(repo, sourcePath);

      progressTracker.advance(alias, RefreshStage.SNAPSHOTTING);
      Path snapshot = snapshotPipeline.createSnapshot(alias, sourcePath);

      progressTracker.advance(alias, RefreshStage.PUBLISHING);
      publish(alias, snapshot);

      failureTracker.reset(alias);
      registry.recordSuccess(alias, clock.instant());
      scheduleCleanupOfPrevious(alias, previousTarget, snapshot);
      progressTracker.complete(alias, RefreshStage.IDLE, "Refresh complete");
      log.info("Refresh of {} complete, now serving {}", alias, snapshot);
      return RefreshResult.refreshed(alias, snapshot);
    } catch (GitFetchException e) {
      return handleFetchFailure(repo, e);
    } catch (RuntimeException e) {
      return handleFailure(alias, e);
    }
  }

  /** Returns true when there is new content to index. */
  private boolean detectAndUpdate(GoldenRepo repo, Path sourcePath, boolean forceReset) {
    String alias = repo.getAlias();
    progressTracker.advance(alias, RefreshStage.DETECTING);
    if (!repo.isGit()) {
      return localChangeDetector.hasLocalChanges(sourcePath, alias);
    }
    if (forceReset) {
      gitUpdater.update(sourcePath, true);
      return true;
    }
    if (!gitChangeDetector.hasChanges(sourcePath)) {
      return false;
    }
    log.info("Pulling latest changes for {}", alias);
    gitUpdater.update(sourcePath, false);
    return true;
  }

  private void publish(String alias, Path snapshot) {
    try {
      aliasManager.swapAlias(alias, snapshot);
    } catch (PublishException e) {
      // never published, so nothing reads it
      cleanupManager.scheduleCleanup(snapshot);
      throw e;
    }
  }

  private void scheduleCleanupOfPrevious(String alias, Path previousTarget, Path snapshot) {
    if (previousTarget.equals(snapshot)) {
      return;
    }
    if (layout.isVersionedSnapshotOf(alias, previousTarget)) {
      cleanupManager.scheduleCleanup(previousTarget);
    } else {
      log.debug("Previous target {} of {} is not a snapshot, keeping it", previousTarget, alias);
    }
  }

  // --- failure handling ---

  private RefreshResult handleFetchFailure(GoldenRepo repo, GitFetchException e) {
    String alias = repo.getAlias();
    int failures = failureTracker.recordFailure(alias);
    RecoveryAction action = recoveryPolicy.decide(e.getCategory(), failures);
    String message =
        "Fetch failed (" + e.getCategory() + ", " + failures + " consecutive): " + e.getMessage();
    registry.recordFailure(alias, message + describeStderr(e), failures);
    progressTracker.advance(alias, RefreshStage.FAILED);

    if (action == RecoveryAction.RETRY_LATER) {
      log.warn("{}; retrying next cycle", message);
      progressTracker.complete(alias, RefreshStage.RETRY_LATER, message);
      return RefreshResult.failed(alias, message, false);
    }

    if (failureTracker.isInCooldown(alias)) {
      log.warn(
          "{}; re-clone of {} suppressed, cooldown active until {}",
          message,
          alias,
          failureTracker.getCooldownUntil(alias).orElse(null));
      progressTracker.complete(alias, RefreshStage.RETRY_LATER, message);
      return RefreshResult.failed(alias, message, false);
    }

    log.warn("{}; re-cloning master clone of {}", message, alias);
    progressTracker.advance(alias, RefreshStage.RECLONE_TRIGGERED);
    boolean recloned =
        reclone(alias, repo.getUpstream(), layout.masterClone(alias), repo.getDefaultBranch());
    failureTracker.startCooldown(alias, recloneCooldown);
    if (recloned) {
      failureTracker.reset(alias);
    }
    String outcome = message + (recloned ? "; re-clone succeeded" : "; re-clone failed");
    progressTracker.complete(alias, RefreshStage.RECLONE_TRIGGERED, outcome);
    return RefreshResult.failed(alias, outcome, true);
  }

  private RefreshResult handleFailure(String alias, RuntimeException e) {
    int failures = failureTracker.recordFailure(alias);
    String message = "Refresh failed: " + e.getMessage();
    log.error("Refresh of {} failed ({} consecutive)", alias, failures, e);
    registry.recordFailure(alias, message, failures);
    progressTracker.complete(alias, RefreshStage.FAILED, message);
    return RefreshResult.failed(alias, message, false);
  }

  private static String describeStderr(GitFetchException e) {
    String stderr = e.getStderr().strip();
    return stderr.isEmpty() ? "" : "\n" + stderr;
  }

  // --- re-clone ---

  /**
   * Deletes the flat master clone of {@code alias} and clones it again from {@code upstream}.
   * Versioned snapshots and the alias binding are left alone.
   *
   * @param masterPath must be exactly {@code <golden-repos-dir>/<alias>}; any other path is refused
   * @return true if the fresh clone succeeded
   */
  public boolean attemptReclone(String alias, String upstream, Path masterPath) {
    String branch = registry.find(alias).map(GoldenRepo::getDefaultBranch).orElse(null);
    return reclone(alias, upstream, masterPath, branch);
  }

  private boolean reclone(String alias, String upstream, Path masterPath, @Nullable String branch) {
    Path expected = layout.masterClone(alias);
    if (!masterPath.toAbsolutePath().normalize().equals(expected)) {
      log.error(
          "Refusing to re-clone {}: {} is not its master clone {}", alias, masterPath, expected);
      return false;
    }
    try {
      FileTrees.deleteRecursively(expected);
      gitUpdater.clone(upstream, expected, branch);
      log.info("Re-cloned {} from {}", alias, upstream);
      return true;
    } catch (IOException | RuntimeException e) {
      log.error("Re-clone of {} from {} failed", alias, upstream, e);
      return false;
    }
  }

  // --- introspection ---

  public int getFailureCount(String alias) {
    return failureTracker.getFailureCount(alias);
  }

  public boolean isInRecloneCooldown(String alias) {
    return failureTracker.isInCooldown(alias);
  }

  public boolean isInFlight(String alias) {
    return inFlight.contains(alias);
  }

  /** Exposed for tests that need to seed cooldowns or counters. */
  FailureTracker failureTracker() {
    return failureTracker;
  }
}
