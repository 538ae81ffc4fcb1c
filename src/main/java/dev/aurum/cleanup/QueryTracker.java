package dev.aurum.cleanup;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thread-safe reference counts of in-flight queries per snapshot path.
 *
 * <p>{@link CleanupManager} never deletes a path whose count is above zero. Paths are normalised to
 * absolute form so callers may pass relative or absolute paths interchangeably.
 */
@Component
public class QueryTracker {

  private static final Logger log = LoggerFactory.getLogger(QueryTracker.class);

  private final ConcurrentHashMap<Path, Integer> refCounts = new ConcurrentHashMap<>();

  /** Increments the count for {@code path} and returns the new value. */
  public int acquire(Path path) {
    return refCounts.merge(normalize(path), 1, Integer::sum);
  }

  /**
   * Decrements the count for {@code path}. Releasing an untracked path is logged and ignored.
   *
   * @return the remaining count
   */
  public int release(Path path) {
    Path key = normalize(path);
    if (!refCounts.containsKey(key)) {
      log.warn("Release of untracked path {} ignored", key);
      return 0;
    }
    Integer remaining =
        refCounts.computeIfPresent(key, (p, count) -> count <= 1 ? null : count - 1);
    return remaining == null ? 0 : remaining;
  }

  public int getRefCount(Path path) {
    return refCounts.getOrDefault(normalize(path), 0);
  }

  /** Acquires a reference that is released when the returned lease is closed. */
  public QueryLease track(Path path) {
    Path key = normalize(path);
    acquire(key);
    return new QueryLease(this, key);
  }

  /** Snapshot of all non-zero counts, for diagnostics. */
  public Map<Path, Integer> activeCounts() {
    return Map.copyOf(refCounts);
  }

  private static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
