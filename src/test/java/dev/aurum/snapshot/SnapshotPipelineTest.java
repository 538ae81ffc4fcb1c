package dev.aurum.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.aurum.config.AurumProperties;
import dev.aurum.fixture.GoldenRepoBuilder;
import dev.aurum.fixture.MutableClock;
import dev.aurum.fixture.ScriptedCommandRunner;
import dev.aurum.layout.GoldenRepoLayout;
import dev.aurum.process.CommandTimeoutException;
import dev.aurum.registry.GoldenRepo;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotPipelineTest {

  private static final long NOW = 1_700_000_000L;

  @TempDir Path root;

  private final MutableClock clock = MutableClock.at(NOW);
  private final AurumProperties properties = new AurumProperties();
  private ScriptedCommandRunner runner;
  private GoldenRepoLayout layout;
  private SnapshotPipeline pipeline;
  private Path source;

  @BeforeEach
  void setUp() throws IOException {
    layout = new GoldenRepoLayout(root);
    runner = new ScriptedCommandRunner().on("cp ", ScriptedCommandRunner::copyTree);
    pipeline =
        new SnapshotPipeline(runner, layout, new IndexArtifactsHealthCheck(), clock, properties);
    source = Files.createDirectories(root.resolve("repo"));
    Files.writeString(source.resolve("Main.java"), "class Main {}");
    Files.createDirectories(source.resolve(".code-indexer/index/voyage-code-3"));
  }

  @Test
  void indexesWithFtsInSourceDirectory() {
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").build();

    pipeline.indexSource(repo, source);

    assertThat(runner.invocations())
        .singleElement()
        .satisfies(
            inv -> {
              assertThat(inv.command()).containsExactly("cidx", "index", "--fts");
              assertThat(inv.workingDir()).isEqualTo(source);
              assertThat(inv.timeout()).isEqualTo(properties.getIndexer().getIndexTimeout());
            });
  }

  @Test
  void temporalIndexingPassesLimitsInOrder() {
    GoldenRepo repo =
        new GoldenRepoBuilder()
            .alias("repo")
            .enableTemporal(true)
            .temporalMaxCommits(500)
            .temporalSinceDate("2024-01-01")
            .enableScip(true)
            .build();

    pipeline.indexSource(repo, source);

    assertThat(runner.lines())
        .containsExactly(
            "cidx index --fts",
            "cidx index --index-commits --max-commits 500 --since-date 2024-01-01",
            "cidx scip generate");
  }

  @Test
  void localReposSkipTemporalIndexing() {
    GoldenRepo repo =
        new GoldenRepoBuilder().alias("repo").local(source.toString()).enableTemporal(true).build();

    pipeline.indexSource(repo, source);

    assertThat(runner.lines()).containsExactly("cidx index --fts");
  }

  @Test
  void failedIndexStepRaisesIndexingException() {
    runner.onExit("cidx index --fts", 1, "", "embedding provider unreachable");
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").enableScip(true).build();

    assertThatThrownBy(() -> pipeline.indexSource(repo, source))
        .isInstanceOf(IndexingException.class)
        .hasMessageContaining("embedding provider unreachable");
    assertThat(runner.lines()).containsExactly("cidx index --fts");
  }

  @Test
  void indexerTimeoutRaisesIndexingException() {
    runner.on(
        "cidx index",
        inv -> {
          throw new CommandTimeoutException(inv.command(), inv.timeout());
        });
    GoldenRepo repo = new GoldenRepoBuilder().alias("repo").build();

    assertThatThrownBy(() -> pipeline.indexSource(repo, source))
        .isInstanceOf(IndexingException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void snapshotIsCopiedAndFixedInPlace() {
    Path snapshot = pipeline.createSnapshot("repo", source);

    assertThat(snapshot).isEqualTo(layout.versionedDir("repo").resolve("v_" + NOW));
    assertThat(snapshot.resolve("Main.java")).hasContent("class Main {}");
    assertThat(runner.invocationsStartingWith("cidx fix-config"))
        .singleElement()
        .satisfies(inv -> assertThat(inv.workingDir()).isEqualTo(snapshot));
    assertThat(runner.invocations())
        .noneSatisfy(inv -> assertThat(inv.workingDir()).isEqualTo(source));
  }

  @Test
  void gitStateIsRepairedOnlyWhenSnapshotIsAWorkingCopy() throws IOException {
    pipeline.createSnapshot("repo", source);
    assertThat(runner.invocationsStartingWith("git ")).isEmpty();

    Files.createDirectories(source.resolve(".git"));
    clock.advance(Duration.ofMinutes(1));
    Path snapshot = pipeline.createSnapshot("repo", source);

    assertThat(runner.invocationsStartingWith("git "))
        .extracting(ScriptedCommandRunner.Invocation::line)
        .containsExactly("git update-index --refresh", "git restore .");
    assertThat(runner.invocationsStartingWith("git "))
        .allSatisfy(inv -> assertThat(inv.workingDir()).isEqualTo(snapshot));
  }

  @Test
  void gitRepairFailureIsNotFatal() throws IOException {
    Files.createDirectories(source.resolve(".git"));
    runner.onExit("git restore", 1, "", "error: pathspec");

    assertThat(pipeline.createSnapshot("repo", source)).isDirectory();
  }

  @Test
  void nameCollisionWaitsForTheNextSecondInsteadOfNamingAhead() throws IOException {
    Files.createDirectories(layout.versionedDir("repo").resolve("v_" + NOW));
    List<Duration> sleeps = new ArrayList<>();
    pipeline =
        pipelineSleepingWith(
            duration -> {
              sleeps.add(duration);
              clock.advance(duration);
            });

    Path snapshot = pipeline.createSnapshot("repo", source);

    assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    assertThat(snapshot.getFileName().toString()).isEqualTo("v_" + (NOW + 1));
    assertThat(clock.instant().getEpochSecond()).isEqualTo(NOW + 1);
  }

  @Test
  void snapshotAheadOfTheClockIsRejected() throws IOException {
    Files.createDirectories(layout.versionedDir("repo").resolve("v_" + (NOW + 3600)));
    pipeline = pipelineSleepingWith(clock::advance);

    assertThatThrownBy(() -> pipeline.createSnapshot("repo", source))
        .isInstanceOf(SnapshotException.class)
        .hasMessageContaining("ahead of the clock");
    assertThat(runner.invocations()).isEmpty();
  }

  @Test
  void stuckClockGivesUpWaiting() throws IOException {
    Files.createDirectories(layout.versionedDir("repo").resolve("v_" + NOW));
    pipeline = pipelineSleepingWith(duration -> {});

    assertThatThrownBy(() -> pipeline.createSnapshot("repo", source))
        .isInstanceOf(SnapshotException.class)
        .hasMessageContaining("did not advance");
  }

  @Test
  void failedFixConfigRemovesOnlyTheNewSnapshot() throws IOException {
    Path older = Files.createDirectories(layout.versionedDir("repo").resolve("v_1"));
    runner.onExit("cidx fix-config", 2, "", "config locked");

    assertThatThrownBy(() -> pipeline.createSnapshot("repo", source))
        .isInstanceOf(SnapshotException.class)
        .hasMessageContaining("config locked");

    try (Stream<Path> children = Files.list(layout.versionedDir("repo"))) {
      assertThat(children).containsExactly(older);
    }
    assertThat(source.resolve("Main.java")).exists();
  }

  @Test
  void snapshotWithoutIndexIsRejected() throws IOException {
    Path bare = Files.createDirectories(root.resolve("bare"));
    Files.writeString(bare.resolve("README"), "no index");

    assertThatThrownBy(() -> pipeline.createSnapshot("bare", bare))
        .isInstanceOf(SnapshotException.class)
        .hasMessageContaining("Index validation failed");
    assertThat(layout.versionedDir("bare").resolve("v_" + NOW)).doesNotExist();
  }

  @Test
  void failedCopyRaisesSnapshotException() {
    runner.onExit("cp ", 1, "", "No space left on device");

    assertThatThrownBy(() -> pipeline.createSnapshot("repo", source))
        .isInstanceOf(SnapshotException.class)
        .hasMessageContaining("No space left on device");
  }

  private SnapshotPipeline pipelineSleepingWith(SnapshotPipeline.Sleeper sleeper) {
    return new SnapshotPipeline(
        runner, layout, new IndexArtifactsHealthCheck(), clock, properties, sleeper);
  }
}
