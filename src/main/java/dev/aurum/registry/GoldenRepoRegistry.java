package dev.aurum.registry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read and update access to registered golden repos, used by the scheduler to list work and to
 * record the outcome of each refresh.
 */
@Service
public class GoldenRepoRegistry {

  private static final Logger log = LoggerFactory.getLogger(GoldenRepoRegistry.class);

  static final int MAX_ERROR_LENGTH = 4000;

  private final GoldenRepoRepository repository;

  public GoldenRepoRegistry(GoldenRepoRepository repository) {
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public List<String> listAliases() {
    return repository.findAllAliases();
  }

  @Transactional(readOnly = true)
  public Optional<GoldenRepo> find(String alias) {
    return repository.findByAlias(alias);
  }

  @Transactional(readOnly = true)
  public Optional<Instant> getLastRefreshAt(String alias) {
    return repository.findByAlias(alias).map(GoldenRepo::getLastRefreshAt);
  }

  @Transactional(readOnly = true)
  public Optional<String> getLastError(String alias) {
    return repository.findByAlias(alias).map(GoldenRepo::getLastError);
  }

  @Transactional(readOnly = true)
  public int getConsecutiveFailures(String alias) {
    return repository.findByAlias(alias).map(GoldenRepo::getConsecutiveFailures).orElse(0);
  }

  @Transactional
  public void markRefreshing(String alias) {
    repository
        .findByAlias(alias)
        .ifPresent(repo -> repo.setRefreshStatus(RefreshStatus.REFRESHING));
  }

  /** Records a successful cycle. A null timestamp keeps the previous refresh time (no change). */
  @Transactional
  public void recordSuccess(String alias, @Nullable Instant refreshedAt) {
    repository
        .findByAlias(alias)
        .ifPresentOrElse(
            repo -> {
              if (refreshedAt != null) {
                repo.setLastRefreshAt(refreshedAt);
              }
              repo.setRefreshStatus(RefreshStatus.IDLE);
              repo.setLastError(null);
              repo.setConsecutiveFailures(0);
            },
            () -> log.warn("Cannot record refresh of unknown alias {}", alias));
  }

  @Transactional
  public void recordFailure(String alias, String error, int consecutiveFailures) {
    repository
        .findByAlias(alias)
        .ifPresentOrElse(
            repo -> {
              repo.setRefreshStatus(RefreshStatus.FAILED);
              repo.setLastError(truncate(error));
              repo.setConsecutiveFailures(consecutiveFailures);
            },
            () -> log.warn("Cannot record failure of unknown alias {}", alias));
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
