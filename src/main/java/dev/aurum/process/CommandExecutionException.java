package dev.aurum.process;

/** Thrown when a subprocess cannot be started, awaited or its output collected. */
public class CommandExecutionException extends RuntimeException {

  public CommandExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
