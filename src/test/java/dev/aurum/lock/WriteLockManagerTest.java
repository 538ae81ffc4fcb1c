package dev.aurum.lock;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aurum.fixture.MutableClock;
import dev.aurum.layout.GoldenRepoLayout;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WriteLockManagerTest {

  @TempDir Path root;

  private final MutableClock clock = MutableClock.at(1_700_000_000L);
  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private GoldenRepoLayout layout;
  private WriteLockManager locks;

  @BeforeEach
  void setUp() {
    layout = new GoldenRepoLayout(root);
    locks = new WriteLockManager(layout, objectMapper, clock);
  }

  @Test
  void secondAcquireFailsWhileHeld() {
    assertThat(locks.acquire("repo", "indexer")).isTrue();
    assertThat(locks.acquire("repo", "other")).isFalse();
    assertThat(locks.isLocked("repo")).isTrue();
    assertThat(locks.getLockInfo("repo"))
        .hasValueSatisfying(
            info -> {
              assertThat(info.owner()).isEqualTo("indexer");
              assertThat(info.pid()).isEqualTo(ProcessHandle.current().pid());
            });
  }

  @Test
  void locksAreIndependentPerAlias() {
    assertThat(locks.acquire("a", "w")).isTrue();
    assertThat(locks.acquire("b", "w")).isTrue();
    assertThat(locks.isLocked("c")).isFalse();
  }

  @Test
  void releaseByOtherOwnerIsRefused() {
    locks.acquire("repo", "indexer");

    assertThat(locks.release("repo", "intruder")).isFalse();
    assertThat(locks.isLocked("repo")).isTrue();

    assertThat(locks.release("repo", "indexer")).isTrue();
    assertThat(locks.isLocked("repo")).isFalse();
    assertThat(layout.lockFile("repo")).doesNotExist();
  }

  @Test
  void releaseOfUnheldLockSucceeds() {
    assertThat(locks.release("repo", "anyone")).isTrue();
  }

  @Test
  void expiredLockIsEvicted() {
    locks.acquire("repo", "indexer", Duration.ofMinutes(10));

    clock.advance(Duration.ofMinutes(11));

    assertThat(locks.isLocked("repo")).isFalse();
    assertThat(layout.lockFile("repo")).doesNotExist();
    assertThat(locks.acquire("repo", "next")).isTrue();
  }

  @Test
  void lockOfDeadProcessIsEvicted() throws IOException {
    Files.createDirectories(layout.locksDir());
    WriteLockInfo orphan = new WriteLockInfo("crashed", Long.MAX_VALUE, clock.instant(), 3600);
    Files.write(layout.lockFile("repo"), objectMapper.writeValueAsBytes(orphan));

    assertThat(locks.isLocked("repo")).isFalse();
    assertThat(locks.acquire("repo", "next")).isTrue();
  }

  @Test
  void unreadableLockBlocksUntilDefaultTtlPasses() throws IOException {
    Files.createDirectories(layout.locksDir());
    Path lockFile = layout.lockFile("repo");
    Files.writeString(lockFile, "");
    Files.setLastModifiedTime(lockFile, FileTime.from(clock.instant()));

    assertThat(locks.isLocked("repo")).isTrue();

    clock.advance(WriteLockManager.DEFAULT_TTL.plusSeconds(1));

    assertThat(locks.isLocked("repo")).isFalse();
  }

  @Test
  void liveUnexpiredLockIsNotStale() {
    WriteLockInfo info =
        new WriteLockInfo("me", ProcessHandle.current().pid(), clock.instant(), 60);

    assertThat(locks.isStale(info)).isFalse();
    clock.advance(Duration.ofSeconds(61));
    assertThat(locks.isStale(info)).isTrue();
  }
}
