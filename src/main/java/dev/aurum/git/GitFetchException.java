package dev.aurum.git;

/**
 * Raised when fetching from a golden repo's remote fails. Carries the failure category so the
 * scheduler can decide between retrying and re-cloning.
 */
public class GitFetchException extends RuntimeException {

  private final FailureCategory category;
  private final String stderr;

  public GitFetchException(String message, FailureCategory category, String stderr) {
    super(message);
    this.category = category;
    this.stderr = stderr == null ? "" : stderr;
  }

  public GitFetchException(
      String message, FailureCategory category, String stderr, Throwable cause) {
    super(message, cause);
    this.category = category;
    this.stderr = stderr == null ? "" : stderr;
  }

  public FailureCategory getCategory() {
    return category;
  }

  public String getStderr() {
    return stderr;
  }
}
