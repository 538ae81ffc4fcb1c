package dev.aurum.refresh;

/** What to do after a failed fetch. */
public enum RecoveryAction {
  RETRY_LATER,
  RECLONE
}
