package dev.aurum.refresh;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link RefreshScheduler#executeRefresh(String)}.
 *
 * @param alias the refreshed alias
 * @param success false only when the cycle failed; skips and no-change cycles are successful
 * @param message human-readable summary
 * @param snapshotPath the newly published snapshot, or null if nothing was published
 * @param recloneAttempted whether this cycle deleted and re-cloned the master clone
 */
public record RefreshResult(
    String alias,
    boolean success,
    String message,
    @Nullable Path snapshotPath,
    boolean recloneAttempted) {

  static RefreshResult skipped(String alias, String message) {
    return new RefreshResult(alias, true, message, null, false);
  }

  static RefreshResult noChanges(String alias) {
    return new RefreshResult(alias, true, "No changes detected", null, false);
  }

  static RefreshResult refreshed(String alias, Path snapshotPath) {
    return new RefreshResult(alias, true, "Refresh complete", snapshotPath, false);
  }

  static RefreshResult failed(String alias, String message, boolean recloneAttempted) {
    return new RefreshResult(alias, false, message, null, recloneAttempted);
  }
}
