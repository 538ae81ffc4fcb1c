package dev.aurum.snapshot;

/** The indexer exited with an error or timed out while indexing a source. */
public class IndexingException extends RuntimeException {

  public IndexingException(String message) {
    super(message);
  }

  public IndexingException(String message, Throwable cause) {
    super(message, cause);
  }
}
