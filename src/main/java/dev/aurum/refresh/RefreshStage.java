package dev.aurum.refresh;

/**
 * Stages of one refresh cycle.
 *
 * <p>Success path: {@code DETECTING → (NO_CHANGE | INDEXING → SNAPSHOTTING → PUBLISHING) → IDLE}.
 * Failure path: {@code FAILED → (RETRY_LATER | RECLONE_TRIGGERED)}.
 */
public enum RefreshStage {
  IDLE,
  DETECTING,
  NO_CHANGE,
  INDEXING,
  SNAPSHOTTING,
  PUBLISHING,
  FAILED,
  RETRY_LATER,
  RECLONE_TRIGGERED
}
