package dev.aurum.refresh;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker of refresh progress per alias.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link RefreshProgress} snapshots keyed by alias.
 * Each update atomically replaces the record with a new immutable one via
 * {@code computeIfPresent()}. The last record of a finished cycle is kept until the next cycle
 * starts, so callers can see how the previous refresh ended.
 */
@Component
public class RefreshProgressTracker {

    private final ConcurrentHashMap<String, RefreshProgress> progress = new ConcurrentHashMap<>();
    private final Clock clock;

    public RefreshProgressTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start tracking a new refresh cycle, replacing any previous record.
     *
     * @param alias the alias being refreshed
     */
    public void start(String alias) {
        var now = clock.instant();
        progress.put(alias, new RefreshProgress(alias, RefreshStage.DETECTING, null, now, now));
    }

    /**
     * Move a running cycle to the next stage.
     *
     * @param alias the alias being refreshed
     * @param stage the stage now entered
     */
    public void advance(String alias, RefreshStage stage) {
        progress.computeIfPresent(alias, (a, current) ->
                new RefreshProgress(a, stage, null, current.startedAt(), clock.instant()));
    }

    /**
     * Record the final stage and outcome of a cycle.
     *
     * @param alias   the alias that finished
     * @param stage   final stage ({@code IDLE}, {@code NO_CHANGE}, {@code RETRY_LATER}, ...)
     * @param message outcome summary
     */
    public void complete(String alias, RefreshStage stage, String message) {
        progress.computeIfPresent(alias, (a, current) ->
                new RefreshProgress(a, stage, message, current.startedAt(), clock.instant()));
    }

    /**
     * Get the current or last progress snapshot for an alias.
     *
     * @param alias the alias to check
     * @return progress snapshot, or empty if the alias was never refreshed
     */
    public Optional<RefreshProgress> getProgress(String alias) {
        return Optional.ofNullable(progress.get(alias));
    }

    /** All tracked aliases and their progress. */
    public Map<String, RefreshProgress> getAll() {
        return Map.copyOf(progress);
    }

    /**
     * Remove an alias from tracking.
     *
     * @param alias the alias to forget
     */
    public void remove(String alias) {
        progress.remove(alias);
    }
}
