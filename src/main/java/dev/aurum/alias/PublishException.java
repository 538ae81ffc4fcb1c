package dev.aurum.alias;

/** Thrown when an alias binding cannot be written. The previous binding stays in effect. */
public class PublishException extends RuntimeException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
