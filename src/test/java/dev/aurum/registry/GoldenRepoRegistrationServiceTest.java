package dev.aurum.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.aurum.alias.AliasManager;
import dev.aurum.alias.PublishException;
import dev.aurum.git.GitUpdater;
import dev.aurum.git.RemoteBranchService;
import dev.aurum.git.RemoteBranches;
import dev.aurum.layout.GoldenRepoLayout;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class GoldenRepoRegistrationServiceTest {

  @TempDir Path root;

  @Mock GoldenRepoRepository repository;

  @Mock AliasManager aliasManager;

  @Mock GitUpdater gitUpdater;

  @Mock RemoteBranchService remoteBranchService;

  GoldenRepoLayout layout;

  GoldenRepoRegistrationService service;

  @BeforeEach
  void setUp() {
    layout = new GoldenRepoLayout(root);
    service =
        new GoldenRepoRegistrationService(
            repository, aliasManager, gitUpdater, remoteBranchService, layout);
  }

  @Test
  void gitRepoDiscoversBranchClonesAndBindsMaster() {
    String url = "https://git.example.com/repo.git";
    when(remoteBranchService.fetchRemoteBranches(url))
        .thenReturn(new RemoteBranches(List.of("develop", "main"), "develop"));
    when(repository.save(any(GoldenRepo.class))).thenAnswer(inv -> inv.getArgument(0));

    GoldenRepo saved = service.register("repo", SourceKind.GIT, url, null, true, false);

    assertThat(saved.getDefaultBranch()).isEqualTo("develop");
    assertThat(saved.isEnableTemporal()).isTrue();
    verify(gitUpdater).clone(url, layout.masterClone("repo"), "develop");
    verify(aliasManager).createAlias("repo", layout.masterClone("repo"));
  }

  @Test
  void explicitBranchSkipsDiscovery() {
    when(repository.save(any(GoldenRepo.class))).thenAnswer(inv -> inv.getArgument(0));

    service.register("repo", SourceKind.GIT, "https://x/repo.git", "release", false, false);

    verifyNoInteractions(remoteBranchService);
    verify(gitUpdater).clone("https://x/repo.git", layout.masterClone("repo"), "release");
  }

  @Test
  void localRepoBindsItsOwnDirectory() throws Exception {
    Path source = Files.createDirectories(root.resolve("work/local-src"));
    when(repository.save(any(GoldenRepo.class))).thenAnswer(inv -> inv.getArgument(0));

    GoldenRepo saved =
        service.register("local", SourceKind.LOCAL, source.toString(), null, false, true);

    assertThat(saved.isGit()).isFalse();
    verify(aliasManager).createAlias("local", source);
    verifyNoInteractions(gitUpdater);
  }

  @Test
  void localRepoMustBeExistingAbsoluteDirectory() {
    String missing = root.resolve("missing").toString();

    assertThatThrownBy(
            () -> service.register("local", SourceKind.LOCAL, "relative/dir", null, false, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> service.register("local", SourceKind.LOCAL, missing, null, false, false))
        .isInstanceOf(IllegalArgumentException.class);
    verify(repository, never()).save(any());
  }

  @Test
  void duplicateAliasIsRejected() {
    when(repository.existsByAlias("repo")).thenReturn(true);

    assertThatThrownBy(
            () -> service.register("repo", SourceKind.GIT, "https://x/r.git", "main", false, false))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("already registered");
    verifyNoInteractions(gitUpdater);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", ".hidden", "a/b", "../escape", "with space"})
  void invalidAliasesAreRejected(String alias) {
    assertThatThrownBy(() -> GoldenRepoRegistrationService.validateAlias(alias))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void failedBindingRemovesFreshClone() {
    Path master = layout.masterClone("repo");
    doAnswer(
            inv -> {
              Files.createDirectories(master.resolve(".git"));
              return null;
            })
        .when(gitUpdater)
        .clone(eq("https://x/r.git"), eq(master), eq("main"));
    when(repository.save(any(GoldenRepo.class))).thenAnswer(inv -> inv.getArgument(0));
    when(aliasManager.createAlias("repo", master)).thenThrow(new PublishException("disk full"));

    assertThatThrownBy(
            () -> service.register("repo", SourceKind.GIT, "https://x/r.git", "main", false, false))
        .isInstanceOf(PublishException.class);

    assertThat(master).doesNotExist();
  }
}
