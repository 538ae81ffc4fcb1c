package dev.aurum.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Runs external commands (git, the indexer, cp) with an explicit timeout.
 *
 * <p>Implementations never interpret the exit code; callers decide what a non-zero status means.
 */
public interface CommandRunner {

  /**
   * Runs {@code command} in {@code workingDir} with extra environment variables.
   *
   * @throws CommandTimeoutException if the process outlives {@code timeout}; it is killed first
   * @throws CommandExecutionException if the process cannot be started or its output read
   */
  CommandResult run(
      List<String> command,
      @Nullable Path workingDir,
      Duration timeout,
      Map<String, String> environment);

  default CommandResult run(List<String> command, @Nullable Path workingDir, Duration timeout) {
    return run(command, workingDir, timeout, Map.of());
  }
}
