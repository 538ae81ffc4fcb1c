package dev.aurum.git;

import dev.aurum.config.AurumProperties;
import dev.aurum.process.CommandResult;
import dev.aurum.process.CommandRunner;
import dev.aurum.process.CommandTimeoutException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brings a golden repo's flat master clone up to date with its remote.
 *
 * <p>Before pulling, tracked local modifications are discarded with {@code git reset --hard HEAD}.
 * A pull rejected because local and remote history diverged is recovered by resetting to {@code
 * origin/<branch>}; any other pull failure is raised as a {@link GitCommandException}.
 */
@Component
public class GitUpdater {

  private static final Logger log = LoggerFactory.getLogger(GitUpdater.class);

  static final String FALLBACK_BRANCH = "main";

  private final CommandRunner commandRunner;
  private final AurumProperties properties;

  public GitUpdater(CommandRunner commandRunner, AurumProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  /**
   * Updates the master clone.
   *
   * @param masterPath the flat clone to update
   * @param forceReset skip {@code git pull} and hard-reset to the remote branch
   * @throws GitFetchException if the fetch before a reset fails, classified for auto-recovery
   * @throws GitCommandException if pull or reset fails or times out
   */
  public void update(Path masterPath, boolean forceReset) {
    discardLocalModifications(masterPath);

    if (forceReset) {
      String branch = detectBranch(masterPath);
      log.info("Force reset requested for {}, resetting to origin/{}", masterPath, branch);
      fetchAndReset(masterPath, branch);
      return;
    }

    log.info("Pulling {}", masterPath);
    CommandResult pull = git(masterPath, List.of("git", "pull"), "pull", GitEnvironment.NO_PROMPT);
    if (pull.isSuccess()) {
      log.info("Pull of {} succeeded: {}", masterPath, pull.stdout().strip());
      return;
    }

    String stderr = pull.stderr();
    if (stderr.contains("divergent branches")
        || stderr.contains("Need to specify how to reconcile")) {
      log.warn("Divergent branches in {}, recovering via fetch + reset --hard", masterPath);
      String branch = detectBranch(masterPath);
      fetchAndReset(masterPath, branch);
      log.info("Recovered {} onto origin/{}", masterPath, branch);
      return;
    }
    throw new GitCommandException("git pull failed for " + masterPath + ": " + stderr.strip());
  }

  /**
   * Returns the checked-out branch name, falling back to {@code main} when it cannot be read.
   *
   * @param repoPath a git working copy
   */
  public String detectBranch(Path repoPath) {
    try {
      CommandResult result =
          commandRunner.run(
              List.of("git", "rev-parse", "--abbrev-ref", "HEAD"),
              repoPath,
              properties.getGit().getCommandTimeout());
      String branch = result.stdout().strip();
      if (result.isSuccess() && !branch.isEmpty()) {
        return branch;
      }
      log.warn(
          "git rev-parse failed for {} (exit {}), falling back to '{}'",
          repoPath,
          result.exitCode(),
          FALLBACK_BRANCH);
    } catch (RuntimeException e) {
      log.warn(
          "git rev-parse raised {} for {}, falling back to '{}'",
          e.getClass().getSimpleName(),
          repoPath,
          FALLBACK_BRANCH);
    }
    return FALLBACK_BRANCH;
  }

  /**
   * Clones {@code upstream} into {@code target}.
   *
   * @param branch branch to check out, or null for the remote default
   * @throws GitCommandException if the clone fails or times out
   */
  public void clone(String upstream, Path target, @Nullable String branch) {
    List<String> command = new ArrayList<>(List.of("git", "clone"));
    if (branch != null && !branch.isBlank()) {
      command.add("--branch");
      command.add(branch);
    }
    command.add(upstream);
    command.add(target.toString());

    Path parent = target.toAbsolutePath().getParent();
    log.info("Cloning {} into {}", upstream, target);
    CommandResult result;
    try {
      Files.createDirectories(parent);
      result =
          commandRunner.run(
              command, parent, properties.getGit().getCloneTimeout(), GitEnvironment.NO_PROMPT);
    } catch (IOException e) {
      throw new GitCommandException("Cannot create parent directory " + parent, e);
    } catch (CommandTimeoutException e) {
      throw new GitCommandException("git clone timed out for " + upstream, e);
    }
    if (!result.isSuccess()) {
      throw new GitCommandException(
          "git clone of " + upstream + " failed: " + result.stderr().strip());
    }
  }

  private void discardLocalModifications(Path masterPath) {
    CommandResult status;
    try {
      status =
          commandRunner.run(
              List.of("git", "status", "--porcelain"),
              masterPath,
              properties.getGit().getCommandTimeout());
    } catch (CommandTimeoutException e) {
      log.warn("git status timed out for {}, continuing with pull", masterPath);
      return;
    }
    if (!status.isSuccess() || status.stdout().isBlank()) {
      return;
    }

    log.warn(
        "Local modifications in {}, resetting to HEAD before pull: {}",
        masterPath,
        status.stdout().strip());
    CommandResult reset =
        commandRunner.run(
            List.of("git", "reset", "--hard", "HEAD"),
            masterPath,
            properties.getGit().getCommandTimeout());
    if (!reset.isSuccess()) {
      log.warn(
          "git reset failed for {}: {}. Proceeding with pull anyway.",
          masterPath,
          reset.stderr().strip());
    }
  }

  private void fetchAndReset(Path masterPath, String branch) {
    CommandResult fetch;
    try {
      fetch =
          commandRunner.run(
              List.of("git", "fetch", "origin"),
              masterPath,
              properties.getGit().getFetchTimeout(),
              GitEnvironment.NO_PROMPT);
    } catch (CommandTimeoutException e) {
      throw new GitFetchException(
          "git fetch timed out for " + masterPath, FailureCategory.TRANSIENT, "", e);
    }
    if (!fetch.isSuccess()) {
      FailureCategory category = GitErrorClassifier.classify(fetch.stderr());
      log.warn(
          "git fetch failed for {} during reset to origin/{} (category={})",
          masterPath,
          branch,
          category);
      throw new GitFetchException(
          "git fetch failed for " + masterPath + " during reset to origin/" + branch,
          category,
          fetch.stderr());
    }
    CommandResult reset =
        git(masterPath, List.of("git", "reset", "--hard", "origin/" + branch), "reset", Map.of());
    if (!reset.isSuccess()) {
      throw new GitCommandException(
          "git reset --hard origin/"
              + branch
              + " failed for "
              + masterPath
              + ": "
              + reset.stderr().strip());
    }
  }

  private CommandResult git(
      Path masterPath, List<String> command, String step, Map<String, String> environment) {
    try {
      return commandRunner.run(
          command, masterPath, properties.getGit().getPullTimeout(), environment);
    } catch (CommandTimeoutException e) {
      throw new GitCommandException("git " + step + " timed out for " + masterPath, e);
    }
  }
}
