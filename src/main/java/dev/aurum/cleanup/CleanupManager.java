package dev.aurum.cleanup;

import dev.aurum.config.AurumProperties;
import dev.aurum.layout.FileTrees;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Reclaims superseded snapshot directories.
 *
 * <p>A queued path is deleted on a periodic pass only once no query holds it (see {@link
 * QueryTracker}) and the grace period since it was queued has elapsed. A failed deletion is
 * retried with exponential backoff (1s doubling, capped at 60s); after {@value #MAX_FAILURES}
 * consecutive failures the path is dropped from the queue and left on disk.
 */
@Component
public class CleanupManager implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(CleanupManager.class);

  static final int MAX_FAILURES = 5;
  static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
  static final Duration MAX_BACKOFF = Duration.ofSeconds(60);

  private final QueryTracker queryTracker;
  private final Clock clock;
  private final TaskScheduler loopScheduler;
  private final PathDeleter deleter;
  private final Duration gracePeriod;
  private final Duration checkInterval;
  private final ConcurrentHashMap<Path, PendingCleanup> pending = new ConcurrentHashMap<>();

  private volatile @Nullable ScheduledFuture<?> loop;

  @Autowired
  public CleanupManager(
      QueryTracker queryTracker,
      Clock clock,
      AurumProperties properties,
      @Qualifier("loopScheduler") TaskScheduler loopScheduler) {
    this(queryTracker, clock, properties, loopScheduler, FileTrees::deleteRecursively);
  }

  CleanupManager(
      QueryTracker queryTracker,
      Clock clock,
      AurumProperties properties,
      TaskScheduler loopScheduler,
      PathDeleter deleter) {
    this.queryTracker = queryTracker;
    this.clock = clock;
    this.loopScheduler = loopScheduler;
    this.deleter = deleter;
    this.gracePeriod = properties.getCleanup().getGracePeriod();
    this.checkInterval = properties.getCleanup().getCheckInterval();
  }

  /**
   * Queues {@code path} for deletion. Re-scheduling an already queued path keeps its original
   * timestamp.
   */
  public void scheduleCleanup(Path path) {
    Path key = path.toAbsolutePath().normalize();
    Instant now = clock.instant();
    PendingCleanup existing = pending.putIfAbsent(key, new PendingCleanup(key, now, 0, now));
    if (existing == null) {
      log.info("Scheduled cleanup of {} (grace period {})", key, gracePeriod);
    }
  }

  /** Paths still waiting for deletion, oldest first. */
  public List<PendingCleanup> getPendingCleanups() {
    return pending.values().stream()
        .sorted(Comparator.comparing(PendingCleanup::scheduledAt))
        .toList();
  }

  /**
   * Runs one cleanup pass over the queue.
   *
   * @return number of directories deleted
   */
  public int runCleanupPass() {
    int deleted = 0;
    for (PendingCleanup entry : List.copyOf(pending.values())) {
      Instant now = clock.instant();
      if (now.isBefore(entry.scheduledAt().plus(gracePeriod))
          || now.isBefore(entry.nextAttemptAt())) {
        continue;
      }
      int refs = queryTracker.getRefCount(entry.path());
      if (refs > 0) {
        log.debug("Deferring cleanup of {}: {} active quer(ies)", entry.path(), refs);
        continue;
      }
      if (delete(entry, now)) {
        deleted++;
      }
    }
    return deleted;
  }

  private boolean delete(PendingCleanup entry, Instant now) {
    try {
      deleter.delete(entry.path());
      pending.remove(entry.path());
      log.info("Deleted superseded snapshot {}", entry.path());
      return true;
    } catch (IOException e) {
      PendingCleanup failed = entry.afterFailure(now.plus(backoff(entry.failures() + 1)));
      if (failed.failures() >= MAX_FAILURES) {
        pending.remove(entry.path());
        log.error(
            "Giving up on cleanup of {} after {} failures; leaving it on disk",
            entry.path(),
            failed.failures(),
            e);
      } else {
        pending.put(entry.path(), failed);
        log.warn(
            "Cleanup of {} failed (attempt {}), retrying after {}: {}",
            entry.path(),
            failed.failures(),
            failed.nextAttemptAt(),
            e.getMessage());
      }
      return false;
    }
  }

  static Duration backoff(int failures) {
    if (failures <= 0) {
      return Duration.ZERO;
    }
    long seconds = INITIAL_BACKOFF.getSeconds() << Math.min(failures - 1, 30);
    return seconds >= MAX_BACKOFF.getSeconds() ? MAX_BACKOFF : Duration.ofSeconds(seconds);
  }

  @Override
  public synchronized void start() {
    if (loop != null) {
      return;
    }
    loop =
        loopScheduler.scheduleWithFixedDelay(
            this::runCleanupPassSafely,
            loopScheduler.getClock().instant().plus(checkInterval),
            checkInterval);
    log.info(
        "Cleanup manager started (check interval {}, grace period {})",
        checkInterval,
        gracePeriod);
  }

  @Override
  public synchronized void stop() {
    ScheduledFuture<?> future = loop;
    loop = null;
    if (future != null) {
      future.cancel(false);
      log.info("Cleanup manager stopped with {} path(s) still pending", pending.size());
    }
  }

  @Override
  public boolean isRunning() {
    return loop != null;
  }

  private void runCleanupPassSafely() {
    try {
      runCleanupPass();
    } catch (RuntimeException e) {
      log.error("Cleanup pass failed", e);
    }
  }

  @FunctionalInterface
  interface PathDeleter {
    void delete(Path path) throws IOException;
  }
}
