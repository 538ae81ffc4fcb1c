package dev.aurum.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aurum.layout.GoldenRepoLayout;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * File-based named write locks that let external writers keep the refresh scheduler away from an
 * alias.
 *
 * <p>A lock is the file {@code <root>/.locks/<alias>.lock}, created with {@code CREATE_NEW} so that
 * only one process wins. A lock is stale, and evicted before any check, when its owning process is
 * no longer alive or its TTL has expired.
 */
@Component
public class WriteLockManager {

  private static final Logger log = LoggerFactory.getLogger(WriteLockManager.class);

  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  private final GoldenRepoLayout layout;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ConcurrentHashMap<String, ReentrantLock> guards = new ConcurrentHashMap<>();

  public WriteLockManager(GoldenRepoLayout layout, ObjectMapper objectMapper, Clock clock) {
    this.layout = layout;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Non-blocking attempt to take the write lock for {@code alias}.
   *
   * @return true if the lock was acquired, false if a live lock is held by someone else
   */
  public boolean acquire(String alias, String owner, Duration ttl) {
    Path lockFile = layout.lockFile(alias);
    ReentrantLock guard = guards.computeIfAbsent(alias, a -> new ReentrantLock());
    if (!guard.tryLock()) {
      return false;
    }
    try {
      Files.createDirectories(lockFile.getParent());
      if (Files.exists(lockFile) && !evictIfStale(alias, lockFile)) {
        return false;
      }
      WriteLockInfo info =
          new WriteLockInfo(owner, ProcessHandle.current().pid(), clock.instant(), ttl.toSeconds());
      try (OutputStream out =
          Files.newOutputStream(
              lockFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
        out.write(objectMapper.writeValueAsBytes(info));
      } catch (FileAlreadyExistsException e) {
        return false;
      }
      log.debug("Write lock acquired: alias={} owner={} pid={}", alias, owner, info.pid());
      return true;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to acquire write lock for " + alias, e);
    } finally {
      guard.unlock();
    }
  }

  public boolean acquire(String alias, String owner) {
    return acquire(alias, owner, DEFAULT_TTL);
  }

  /**
   * Releases the lock if {@code owner} holds it.
   *
   * @return true if released or not held, false if held by a different owner
   */
  public boolean release(String alias, String owner) {
    Path lockFile = layout.lockFile(alias);
    Optional<WriteLockInfo> info = read(lockFile);
    if (info.isEmpty()) {
      deleteQuietly(lockFile);
      return true;
    }
    if (!info.get().owner().equals(owner)) {
      log.warn(
          "Write lock release refused for {}: caller={} but lock owned by {}",
          alias,
          owner,
          info.get().owner());
      return false;
    }
    deleteQuietly(lockFile);
    log.debug("Write lock released: alias={} owner={}", alias, owner);
    return true;
  }

  /** True if a live (non-stale) lock exists. Stale locks are evicted as a side effect. */
  public boolean isLocked(String alias) {
    Path lockFile = layout.lockFile(alias);
    return Files.exists(lockFile) && !evictIfStale(alias, lockFile);
  }

  /** Metadata of the live lock, or empty when unlocked. Stale locks are evicted. */
  public Optional<WriteLockInfo> getLockInfo(String alias) {
    if (!isLocked(alias)) {
      return Optional.empty();
    }
    return read(layout.lockFile(alias));
  }

  private boolean evictIfStale(String alias, Path lockFile) {
    Optional<WriteLockInfo> info = read(lockFile);
    boolean stale;
    if (info.isPresent()) {
      stale = isStale(info.get());
    } else {
      stale = isUnreadableAndOld(lockFile);
    }
    if (stale) {
      log.info(
          "Evicting stale write lock for {} (owner={}, pid={})",
          alias,
          info.map(WriteLockInfo::owner).orElse("?"),
          info.map(i -> String.valueOf(i.pid())).orElse("?"));
      deleteQuietly(lockFile);
    }
    return stale;
  }

  boolean isStale(WriteLockInfo info) {
    boolean alive = ProcessHandle.of(info.pid()).map(ProcessHandle::isAlive).orElse(false);
    return !alive || clock.instant().isAfter(info.expiresAt());
  }

  // An empty or half-written file from a crashed writer would otherwise block the alias forever.
  private boolean isUnreadableAndOld(Path lockFile) {
    try {
      Instant modified = Files.getLastModifiedTime(lockFile).toInstant();
      return clock.instant().isAfter(modified.plus(DEFAULT_TTL));
    } catch (NoSuchFileException e) {
      return true;
    } catch (IOException e) {
      log.warn("Could not stat lock file {}: {}", lockFile, e.getMessage());
      return false;
    }
  }

  private Optional<WriteLockInfo> read(Path lockFile) {
    if (!Files.exists(lockFile)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(lockFile.toFile(), WriteLockInfo.class));
    } catch (IOException e) {
      log.warn("Could not read lock file {}: {}", lockFile, e.getMessage());
      return Optional.empty();
    }
  }

  private static void deleteQuietly(Path lockFile) {
    try {
      Files.deleteIfExists(lockFile);
    } catch (IOException e) {
      log.warn("Could not delete lock file {}: {}", lockFile, e.getMessage());
    }
  }
}
