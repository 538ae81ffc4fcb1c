package dev.aurum.git;

/** A git command other than fetch (pull, reset, clone, ls-remote) exited with an error. */
public class GitCommandException extends RuntimeException {

  public GitCommandException(String message) {
    super(message);
  }

  public GitCommandException(String message, Throwable cause) {
    super(message, cause);
  }
}
