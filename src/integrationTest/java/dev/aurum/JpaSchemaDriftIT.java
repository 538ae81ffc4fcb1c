package dev.aurum;

import static org.assertj.core.api.Assertions.assertThat;

import dev.aurum.registry.GoldenRepo;
import dev.aurum.registry.GoldenRepoRepository;
import dev.aurum.registry.RefreshStatus;
import dev.aurum.registry.SourceKind;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=validate by verifying the entity can be persisted and read back against
 * the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private GoldenRepoRepository repository;

  @Test
  void goldenRepoRoundtripsAgainstFlywaySchema() {
    Instant refreshedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    GoldenRepo repo = new GoldenRepo("drift-check", SourceKind.GIT, "https://x/drift.git");
    repo.setDefaultBranch("main");
    repo.setEnableTemporal(true);
    repo.setTemporalMaxCommits(250);
    repo.setTemporalSinceDate("2024-01-01");
    repo.setEnableScip(true);
    repo.setRefreshStatus(RefreshStatus.FAILED);
    repo.setLastError("fatal: unable to access");
    repo.setConsecutiveFailures(2);
    repo.setLastRefreshAt(refreshedAt);

    GoldenRepo saved = repository.saveAndFlush(repo);
    GoldenRepo found = repository.findByAlias("drift-check").orElseThrow();

    assertThat(found.getId()).isEqualTo(saved.getId());
    assertThat(found.getSourceKind()).isEqualTo(SourceKind.GIT);
    assertThat(found.getTemporalMaxCommits()).isEqualTo(250);
    assertThat(found.getTemporalSinceDate()).isEqualTo("2024-01-01");
    assertThat(found.getRefreshStatus()).isEqualTo(RefreshStatus.FAILED);
    assertThat(found.getConsecutiveFailures()).isEqualTo(2);
    assertThat(found.getLastRefreshAt()).isEqualTo(refreshedAt);
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(found.getUpdatedAt()).isNotNull();
  }

  @Test
  void aliasesAreListedInOrder() {
    repository.saveAndFlush(new GoldenRepo("zeta", SourceKind.LOCAL, "/srv/zeta"));
    repository.saveAndFlush(new GoldenRepo("alpha", SourceKind.LOCAL, "/srv/alpha"));

    assertThat(repository.findAllAliases()).containsSubsequence("alpha", "zeta");
    assertThat(repository.existsByAlias("alpha")).isTrue();
  }
}
