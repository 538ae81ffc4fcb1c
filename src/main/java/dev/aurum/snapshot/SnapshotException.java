package dev.aurum.snapshot;

/**
 * Creating a versioned snapshot failed: the copy, path repair or validation step did not succeed.
 * The partial snapshot directory has already been removed when this is thrown.
 */
public class SnapshotException extends RuntimeException {

  public SnapshotException(String message) {
    super(message);
  }

  public SnapshotException(String message, Throwable cause) {
    super(message, cause);
  }
}
