package dev.aurum.snapshot;

import java.nio.file.Path;

/** Pass/fail verdict over a freshly produced snapshot, applied before it is published. */
public interface RepositoryHealthCheck {

  /**
   * @param snapshotPath the new {@code v_<ts>} directory
   * @return true if the snapshot may be published
   */
  boolean isHealthy(Path snapshotPath);
}
