package dev.aurum.git;

/** How a failed {@code git fetch} should be treated by auto-recovery. */
public enum FailureCategory {
  /** Network or remote-side trouble; retrying later is expected to succeed. */
  TRANSIENT,
  /** The local object store or index is damaged; only a fresh clone fixes it. */
  CORRUPTION
}
