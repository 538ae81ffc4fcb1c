package dev.aurum.refresh;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of an alias's current or last refresh.
 *
 * <p>Created and updated by {@link RefreshProgressTracker}. Each mutation produces a new record.
 *
 * @param alias the alias being refreshed
 * @param stage current stage, or the final stage once the cycle ended
 * @param message outcome message once the cycle ended, null while running
 * @param startedAt when the cycle started
 * @param updatedAt when the stage last changed
 */
public record RefreshProgress(
        String alias,
        RefreshStage stage,
        @Nullable String message,
        Instant startedAt,
        Instant updatedAt
) {

    public boolean isRunning() {
        return message == null;
    }
}
