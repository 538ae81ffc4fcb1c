package dev.aurum.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import dev.aurum.fixture.GoldenRepoBuilder;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class GoldenRepoRegistryTest {

  @Mock GoldenRepoRepository repository;

  GoldenRepoRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new GoldenRepoRegistry(repository);
  }

  @Test
  void successStampsRefreshTimeAndClearsFailureState() {
    GoldenRepo repo =
        new GoldenRepoBuilder().alias("repo").refreshStatus(RefreshStatus.FAILED).build();
    repo.setLastError("boom");
    repo.setConsecutiveFailures(2);
    when(repository.findByAlias("repo")).thenReturn(Optional.of(repo));
    Instant now = Instant.parse("2024-01-01T00:00:00Z");

    registry.recordSuccess("repo", now);

    assertThat(repo.getLastRefreshAt()).isEqualTo(now);
    assertThat(repo.getRefreshStatus()).isEqualTo(RefreshStatus.IDLE);
    assertThat(repo.getLastError()).isNull();
    assertThat(repo.getConsecutiveFailures()).isZero();
  }

  @Test
  void successWithoutTimestampKeepsPreviousRefreshTime() {
    Instant earlier = Instant.parse("2023-06-01T00:00:00Z");
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").lastRefreshAt(earlier).build();
    when(repository.findByAlias("repo")).thenReturn(Optional.of(repo));

    registry.recordSuccess("repo", null);

    assertThat(repo.getLastRefreshAt()).isEqualTo(earlier);
    assertThat(repo.getRefreshStatus()).isEqualTo(RefreshStatus.IDLE);
  }

  @Test
  void failureTruncatesLongErrors() {
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").build();
    when(repository.findByAlias("repo")).thenReturn(Optional.of(repo));

    registry.recordFailure("repo", "x".repeat(10_000), 3);

    assertThat(repo.getRefreshStatus()).isEqualTo(RefreshStatus.FAILED);
    assertThat(repo.getLastError()).hasSize(GoldenRepoRegistry.MAX_ERROR_LENGTH);
    assertThat(repo.getConsecutiveFailures()).isEqualTo(3);
  }

  @Test
  void updatesOfUnknownAliasAreIgnored() {
    when(repository.findByAlias("ghost")).thenReturn(Optional.empty());

    registry.recordFailure("ghost", "boom", 1);

    assertThat(registry.getConsecutiveFailures("ghost")).isZero();
    assertThat(registry.getLastRefreshAt("ghost")).isEmpty();
  }

  @Test
  void markRefreshingSetsStatus() {
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").build();
    when(repository.findByAlias("repo")).thenReturn(Optional.of(repo));

    registry.markRefreshing("repo");

    assertThat(repo.getRefreshStatus()).isEqualTo(RefreshStatus.REFRESHING);
  }
}
