package dev.aurum.cleanup;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reference held by an in-flight query on a snapshot path. Closing it releases the reference once;
 * further calls to {@link #close()} do nothing.
 */
public final class QueryLease implements AutoCloseable {

  private final QueryTracker tracker;
  private final Path path;
  private final AtomicBoolean released = new AtomicBoolean();

  QueryLease(QueryTracker tracker, Path path) {
    this.tracker = tracker;
    this.path = path;
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      tracker.release(path);
    }
  }
}
