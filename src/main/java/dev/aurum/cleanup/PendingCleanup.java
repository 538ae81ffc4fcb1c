package dev.aurum.cleanup;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A snapshot path queued for deletion.
 *
 * @param path absolute path to delete
 * @param scheduledAt when the path stopped being the active binding
 * @param failures consecutive failed deletion attempts
 * @param nextAttemptAt earliest instant of the next attempt (backoff after failures)
 */
public record PendingCleanup(Path path, Instant scheduledAt, int failures, Instant nextAttemptAt) {

  PendingCleanup afterFailure(Instant nextAttempt) {
    return new PendingCleanup(path, scheduledAt, failures + 1, nextAttempt);
  }
}
