package dev.aurum.registry;

import dev.aurum.alias.AliasManager;
import dev.aurum.git.GitUpdater;
import dev.aurum.git.RemoteBranchService;
import dev.aurum.layout.FileTrees;
import dev.aurum.layout.GoldenRepoLayout;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registers new golden repos: prepares the source on disk, persists the record and binds the
 * alias.
 *
 * <p>Git repos are cloned into {@code <root>/<alias>}; when no default branch is given it is
 * discovered with {@code git ls-remote}. Local repos must point at an existing directory and are
 * bound to it directly. The first refresh cycle then indexes and publishes a versioned snapshot.
 */
@Service
public class GoldenRepoRegistrationService {

  private static final Logger log = LoggerFactory.getLogger(GoldenRepoRegistrationService.class);

  private static final Pattern VALID_ALIAS = Pattern.compile("[A-Za-z0-9._-]+");

  private final GoldenRepoRepository repository;
  private final AliasManager aliasManager;
  private final GitUpdater gitUpdater;
  private final RemoteBranchService remoteBranchService;
  private final GoldenRepoLayout layout;

  public GoldenRepoRegistrationService(
      GoldenRepoRepository repository,
      AliasManager aliasManager,
      GitUpdater gitUpdater,
      RemoteBranchService remoteBranchService,
      GoldenRepoLayout layout) {
    this.repository = repository;
    this.aliasManager = aliasManager;
    this.gitUpdater = gitUpdater;
    this.remoteBranchService = remoteBranchService;
    this.layout = layout;
  }

  /**
   * Registers a golden repo.
   *
   * @param defaultBranch branch to track for git repos; discovered from the remote when null
   * @throws IllegalArgumentException if the alias is invalid or already registered, or a local
   *     path is not an existing directory
   * @throws dev.aurum.git.GitCommandException if cloning or branch discovery fails
   */
  @Transactional
  public GoldenRepo register(
      String alias,
      SourceKind kind,
      String upstream,
      @Nullable String defaultBranch,
      boolean enableTemporal,
      boolean enableScip) {
    validateAlias(alias);
    if (repository.existsByAlias(alias)) {
      throw new IllegalArgumentException("Alias already registered: " + alias);
    }

    GoldenRepo repo = new GoldenRepo(alias, kind, upstream);
    repo.setEnableTemporal(enableTemporal);
    repo.setEnableScip(enableScip);

    Path boundPath;
    if (kind == SourceKind.GIT) {
      String branch = defaultBranch;
      if (branch == null || branch.isBlank()) {
        branch = remoteBranchService.fetchRemoteBranches(upstream).defaultBranch();
        log.info("Discovered default branch '{}' for {}", branch, upstream);
      }
      repo.setDefaultBranch(branch.isBlank() ? null : branch);
      boundPath = layout.masterClone(alias);
      if (Files.exists(boundPath)) {
        throw new IllegalArgumentException("Master clone path already exists: " + boundPath);
      }
      gitUpdater.clone(upstream, boundPath, repo.getDefaultBranch());
    } else {
      boundPath = Path.of(upstream);
      if (!boundPath.isAbsolute() || !Files.isDirectory(boundPath)) {
        throw new IllegalArgumentException(
            "Local golden repo must be an existing absolute directory: " + upstream);
      }
    }

    try {
      GoldenRepo saved = repository.save(repo);
      aliasManager.createAlias(alias, boundPath);
      log.info("Registered golden repo {} ({}) from {}", alias, kind, upstream);
      return saved;
    } catch (RuntimeException e) {
      if (kind == SourceKind.GIT) {
        removeClone(boundPath);
      }
      throw e;
    }
  }

  static void validateAlias(String alias) {
    if (alias == null || !VALID_ALIAS.matcher(alias).matches() || alias.startsWith(".")) {
      throw new IllegalArgumentException(
          "Invalid alias '"
              + alias
              + "': use letters, digits, '.', '_' or '-', not starting with '.'");
    }
  }

  private static void removeClone(Path clone) {
    try {
      FileTrees.deleteRecursively(clone);
    } catch (IOException e) {
      log.warn("Could not remove clone {} after failed registration: {}", clone, e.getMessage());
    }
  }
}
