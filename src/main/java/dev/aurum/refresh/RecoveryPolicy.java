package dev.aurum.refresh;

import dev.aurum.git.FailureCategory;

/**
 * Decides between retrying and re-cloning after a failed fetch. Corruption is re-cloned at once;
 * transient failures only once they have happened {@code threshold} times in a row.
 */
public final class RecoveryPolicy {

  private final int threshold;

  public RecoveryPolicy(int threshold) {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
    }
    this.threshold = threshold;
  }

  /**
   * @param category classification of the latest failure
   * @param consecutiveFailures counter value including the latest failure
   */
  public RecoveryAction decide(FailureCategory category, int consecutiveFailures) {
    if (category == FailureCategory.CORRUPTION) {
      return RecoveryAction.RECLONE;
    }
    return consecutiveFailures >= threshold ? RecoveryAction.RECLONE : RecoveryAction.RETRY_LATER;
  }

  public int getThreshold() {
    return threshold;
  }
}
