package dev.aurum.process;

import java.time.Duration;
import java.util.List;

/** Thrown when a subprocess does not finish within its timeout. */
public class CommandTimeoutException extends RuntimeException {

  private final List<String> command;
  private final Duration timeout;

  public CommandTimeoutException(List<String> command, Duration timeout) {
    super("Command timed out after " + timeout + ": " + String.join(" ", command));
    this.command = List.copyOf(command);
    this.timeout = timeout;
  }

  public List<String> getCommand() {
    return command;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
