package dev.aurum.lock;

import java.time.Instant;

/**
 * Contents of a {@code .locks/<alias>.lock} file.
 *
 * @param owner human-readable name of the holder
 * @param pid operating system process id of the holder
 * @param acquiredAt when the lock was taken
 * @param ttlSeconds lifetime after which the lock is considered stale
 */
public record WriteLockInfo(String owner, long pid, Instant acquiredAt, long ttlSeconds) {

  public Instant expiresAt() {
    return acquiredAt.plusSeconds(ttlSeconds);
  }
}
