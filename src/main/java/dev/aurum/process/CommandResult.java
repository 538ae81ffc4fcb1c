package dev.aurum.process;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a finished subprocess.
 *
 * @param command the argument vector that was executed
 * @param exitCode process exit status
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param elapsed wall-clock duration of the run
 */
public record CommandResult(
    List<String> command, int exitCode, String stdout, String stderr, Duration elapsed) {

  public CommandResult {
    command = List.copyOf(command);
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  /** Convenience factory for tests and stubs. */
  public static CommandResult of(List<String> command, int exitCode, String stdout, String stderr) {
    return new CommandResult(command, exitCode, stdout, stderr, Duration.ZERO);
  }
}
