package dev.aurum.git;

import dev.aurum.config.AurumProperties;
import dev.aurum.process.CommandResult;
import dev.aurum.process.CommandRunner;
import dev.aurum.process.CommandTimeoutException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Lists the branches of a remote repository without cloning it.
 *
 * <p>Terminal prompts are disabled so that a private repository without credentials fails fast
 * instead of hanging on a password prompt.
 */
@Service
public class RemoteBranchService {

  private static final Logger log = LoggerFactory.getLogger(RemoteBranchService.class);

  static final List<String> COMMON_DEFAULT_BRANCHES =
      List.of("main", "master", "develop", "development", "trunk");

  private static final String HEADS_PREFIX = "refs/heads/";

  private final CommandRunner commandRunner;
  private final AurumProperties properties;

  public RemoteBranchService(CommandRunner commandRunner, AurumProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  /**
   * Fetches branch names and the default branch of {@code url}. Retries on {@link
   * GitCommandException} with exponential backoff.
   *
   * @throws GitCommandException when every attempt failed (after recovery logging)
   */
  @Retryable(
      retryFor = GitCommandException.class,
      maxAttemptsExpression = "${aurum.git.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${aurum.git.retry.delay-ms:1000}",
              multiplierExpression = "${aurum.git.retry.multiplier:2.0}"))
  public RemoteBranches fetchRemoteBranches(String url) {
    CommandResult heads = lsRemote(List.of("git", "ls-remote", "--heads", url));
    if (!heads.isSuccess()) {
      throw new GitCommandException(
          "git ls-remote --heads failed for " + url + ": " + heads.stderr().strip());
    }
    List<String> branches = parseHeads(heads.stdout());

    String symrefTarget = null;
    CommandResult symref = lsRemote(List.of("git", "ls-remote", "--symref", url, "HEAD"));
    if (symref.isSuccess()) {
      symrefTarget = parseSymref(symref.stdout());
    } else {
      log.debug("Could not read HEAD symref for {}: {}", url, symref.stderr().strip());
    }

    return new RemoteBranches(branches, resolveDefaultBranch(branches, symrefTarget));
  }

  @Recover
  RemoteBranches recoverFetchRemoteBranches(GitCommandException e, String url) {
    log.warn("Listing remote branches failed after retries for {}: {}", url, e.getMessage());
    throw e;
  }

  static List<String> parseHeads(String stdout) {
    List<String> branches = new ArrayList<>();
    for (String line : stdout.split("\n")) {
      String[] parts = line.strip().split("\\s+");
      if (parts.length == 2 && parts[1].startsWith(HEADS_PREFIX)) {
        branches.add(parts[1].substring(HEADS_PREFIX.length()));
      }
    }
    return branches;
  }

  static @Nullable String parseSymref(String stdout) {
    for (String line : stdout.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.startsWith("ref:")) {
        String[] parts = trimmed.substring(4).strip().split("\\s+");
        if (parts.length >= 1 && parts[0].startsWith(HEADS_PREFIX)) {
          return parts[0].substring(HEADS_PREFIX.length());
        }
      }
    }
    return null;
  }

  static String resolveDefaultBranch(List<String> branches, @Nullable String symrefTarget) {
    if (symrefTarget != null && branches.contains(symrefTarget)) {
      return symrefTarget;
    }
    for (String candidate : COMMON_DEFAULT_BRANCHES) {
      if (branches.contains(candidate)) {
        return candidate;
      }
    }
    return branches.isEmpty() ? "" : branches.get(0);
  }

  private CommandResult lsRemote(List<String> command) {
    try {
      return commandRunner.run(
          command, null, properties.getGit().getCommandTimeout(), GitEnvironment.NO_PROMPT);
    } catch (CommandTimeoutException e) {
      throw new GitCommandException("Timed out: " + String.join(" ", command), e);
    }
  }
}
