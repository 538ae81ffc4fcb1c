package dev.aurum.detect;

import dev.aurum.config.AurumProperties;
import dev.aurum.git.FailureCategory;
import dev.aurum.git.GitCommandException;
import dev.aurum.git.GitEnvironment;
import dev.aurum.git.GitErrorClassifier;
import dev.aurum.git.GitFetchException;
import dev.aurum.process.CommandResult;
import dev.aurum.process.CommandRunner;
import dev.aurum.process.CommandTimeoutException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects upstream commits for a git golden repo by fetching into its master clone and listing
 * {@code HEAD..@{upstream}}.
 */
@Component
public class GitChangeDetector implements ChangeDetector {

  private static final Logger log = LoggerFactory.getLogger(GitChangeDetector.class);

  private final CommandRunner commandRunner;
  private final AurumProperties properties;

  public GitChangeDetector(CommandRunner commandRunner, AurumProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  @Override
  public boolean hasChanges(Path sourcePath, String alias) {
    return hasChanges(sourcePath);
  }

  /**
   * Fetches from {@code origin} and reports whether the upstream branch is ahead of HEAD.
   *
   * @param masterPath the flat master clone, never a versioned snapshot
   * @throws GitFetchException if the fetch exits non-zero or times out (timeouts are transient)
   * @throws GitCommandException if listing upstream commits fails
   */
  public boolean hasChanges(Path masterPath) {
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
          "git fetch failed for {} (category={}): {}",
          masterPath,
          category,
          fetch.stderr().strip());
      throw new GitFetchException("git fetch failed for " + masterPath, category, fetch.stderr());
    }

    CommandResult pending;
    try {
      pending =
          commandRunner.run(
              List.of("git", "log", "HEAD..@{upstream}", "--oneline"),
              masterPath,
              properties.getGit().getCommandTimeout());
    } catch (CommandTimeoutException e) {
      throw new GitCommandException("git log timed out for " + masterPath, e);
    }
    if (!pending.isSuccess()) {
      throw new GitCommandException(
          "git log failed for " + masterPath + ": " + pending.stderr().strip());
    }

    String commits = pending.stdout().strip();
    if (commits.isEmpty()) {
      return false;
    }
    log.info(
        "Remote changes detected for {}: {} commit(s) to pull",
        masterPath,
        commits.lines().count());
    return true;
  }
}
