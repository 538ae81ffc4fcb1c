package dev.aurum.registry;

/**
 * Last known refresh state of a {@link GoldenRepo}.
 *
 * <p>Normal flow: {@code IDLE → REFRESHING → IDLE}. A failed refresh leaves {@code FAILED} until
 * the next successful one.
 */
public enum RefreshStatus {
  IDLE,
  REFRESHING,
  FAILED
}
