package dev.aurum.refresh;

import static org.assertj.core.api.Assertions.assertThat;

import dev.aurum.BaseIntegrationTest;
import dev.aurum.alias.AliasManager;
import dev.aurum.cleanup.CleanupManager;
import dev.aurum.cleanup.PendingCleanup;
import dev.aurum.fixture.ScriptedCommandRunner;
import dev.aurum.layout.GoldenRepoLayout;
import dev.aurum.process.CommandResult;
import dev.aurum.process.CommandRunner;
import dev.aurum.registry.GoldenRepo;
import dev.aurum.registry.GoldenRepoRegistrationService;
import dev.aurum.registry.GoldenRepoRegistry;
import dev.aurum.registry.RefreshStatus;
import dev.aurum.registry.SourceKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Drives a local golden repo through register, first publish, an unchanged cycle and a changed
 * cycle against the real registry, alias files and snapshot layout. The indexer and {@code cp}
 * are simulated.
 */
class LocalRefreshLifecycleIT extends BaseIntegrationTest {

  @TestConfiguration
  static class FakeIndexerConfig {

    @Bean
    @Primary
    CommandRunner scriptedCommandRunner() {
      return new ScriptedCommandRunner()
          .on("cp ", ScriptedCommandRunner::copyTree)
          .on("cidx index", LocalRefreshLifecycleIT::writeFakeIndex);
    }
  }

  @Autowired private GoldenRepoRegistrationService registrationService;

  @Autowired private GoldenRepoRegistry registry;

  @Autowired private RefreshScheduler scheduler;

  @Autowired private AliasManager aliasManager;

  @Autowired private CleanupManager cleanupManager;

  @Autowired private GoldenRepoLayout layout;

  @Test
  void localRepoIsPublishedOnlyWhenItChanges() throws IOException {
    Path source = Files.createTempDirectory("aurum-local-src-");
    Path file = source.resolve("README.md");
    Files.writeString(file, "# repo-a");
    Files.setLastModifiedTime(file, FileTime.from(Instant.now().minusSeconds(3600)));

    GoldenRepo repo =
        registrationService.register(
            "repo-a", SourceKind.LOCAL, source.toString(), null, false, false);
    assertThat(aliasManager.getActualRepoPath("repo-a")).contains(source);

    RefreshResult first = scheduler.executeRefresh("repo-a");

    assertThat(first.success()).isTrue();
    Path firstSnapshot = first.snapshotPath();
    assertThat(firstSnapshot).isNotNull();
    assertThat(layout.isVersionedSnapshotOf("repo-a", firstSnapshot)).isTrue();
    assertThat(aliasManager.getActualRepoPath("repo-a")).contains(firstSnapshot);
    assertThat(firstSnapshot.resolve("README.md")).hasContent("# repo-a");
    assertThat(registry.find("repo-a"))
        .hasValueSatisfying(
            r -> {
              assertThat(r.getId()).isEqualTo(repo.getId());
              assertThat(r.getLastRefreshAt()).isNotNull();
              assertThat(r.getRefreshStatus()).isEqualTo(RefreshStatus.IDLE);
            });
    // the live source directory is never queued for deletion
    assertThat(cleanupManager.getPendingCleanups())
        .extracting(PendingCleanup::path)
        .doesNotContain(source);

    RefreshResult unchanged = scheduler.executeRefresh("repo-a");

    assertThat(unchanged.message()).isEqualTo("No changes detected");
    assertThat(aliasManager.getActualRepoPath("repo-a")).contains(firstSnapshot);

    Files.writeString(file, "# repo-a v2");
    Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));

    RefreshResult changed = scheduler.executeRefresh("repo-a");

    assertThat(changed.success()).isTrue();
    assertThat(changed.snapshotPath()).isNotEqualTo(firstSnapshot);
    assertThat(aliasManager.getActualRepoPath("repo-a")).contains(changed.snapshotPath());
    assertThat(changed.snapshotPath().resolve("README.md")).hasContent("# repo-a v2");
    assertThat(cleanupManager.getPendingCleanups())
        .extracting(PendingCleanup::path)
        .contains(firstSnapshot);
    // grace period has not elapsed, so the old snapshot is still readable
    assertThat(firstSnapshot).isDirectory();
  }

  private static CommandResult writeFakeIndex(ScriptedCommandRunner.Invocation invocation) {
    try {
      Files.createDirectories(
          invocation.workingDir().resolve(".code-indexer/index/voyage-code-3"));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return CommandResult.of(invocation.command(), 0, "", "");
  }
}
