package dev.aurum.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Standard output and error are redirected to temporary files so a chatty process can never
 * block on a full pipe while we wait for it.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public CommandResult run(
      List<String> command,
      @Nullable Path workingDir,
      Duration timeout,
      Map<String, String> environment) {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    log.debug("Running '{}' in {}", String.join(" ", command), workingDir);

    Path stdoutFile = null;
    Path stderrFile = null;
    long startNanos = System.nanoTime();
    try {
      stdoutFile = Files.createTempFile("aurum-cmd-", ".out");
      stderrFile = Files.createTempFile("aurum-cmd-", ".err");

      ProcessBuilder builder = new ProcessBuilder(command);
      if (workingDir != null) {
        builder.directory(workingDir.toFile());
      }
      builder.environment().putAll(environment);
      builder.redirectOutput(stdoutFile.toFile());
      builder.redirectError(stderrFile.toFile());

      Process process = builder.start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        log.warn("Command '{}' timed out after {}", String.join(" ", command), timeout);
        throw new CommandTimeoutException(command, timeout);
      }

      Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
      return new CommandResult(
          command,
          process.exitValue(),
          Files.readString(stdoutFile, StandardCharsets.UTF_8),
          Files.readString(stderrFile, StandardCharsets.UTF_8),
          elapsed);
    } catch (IOException e) {
      throw new CommandExecutionException(
          "Failed to run command: " + String.join(" ", command), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CommandExecutionException(
          "Interrupted while running command: " + String.join(" ", command), e);
    } finally {
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  private static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not delete temporary output file {}: {}", file, e.getMessage());
    }
  }
}
