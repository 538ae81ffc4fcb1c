package dev.aurum.git;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.aurum.config.AurumProperties;
import dev.aurum.fixture.ScriptedCommandRunner;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteBranchServiceTest {

  private static final String URL = "https://git.example.com/repo.git";

  private ScriptedCommandRunner runner;
  private RemoteBranchService service;

  @BeforeEach
  void setUp() {
    runner = new ScriptedCommandRunner();
    service = new RemoteBranchService(runner, new AurumProperties());
  }

  @Test
  void symrefTargetIsTheDefaultBranch() {
    runner
        .onExit(
            "git ls-remote --heads",
            0,
            "aaa\trefs/heads/feature\nbbb\trefs/heads/release\nccc\trefs/heads/main\n",
            "")
        .onExit("git ls-remote --symref", 0, "ref: refs/heads/release\tHEAD\nbbb\tHEAD\n", "");

    RemoteBranches result = service.fetchRemoteBranches(URL);

    assertThat(result.branches()).containsExactly("feature", "release", "main");
    assertThat(result.defaultBranch()).isEqualTo("release");
  }

  @Test
  void fallsBackToCommonNamesWhenSymrefUnavailable() {
    runner
        .onExit("git ls-remote --heads", 0, "a\trefs/heads/zeta\nb\trefs/heads/master\n", "")
        .onExit("git ls-remote --symref", 128, "", "fatal: protocol error");

    assertThat(service.fetchRemoteBranches(URL).defaultBranch()).isEqualTo("master");
  }

  @Test
  void disablesTerminalPrompts() {
    runner.onExit("git ls-remote --heads", 0, "a\trefs/heads/main\n", "");

    service.fetchRemoteBranches(URL);

    assertThat(runner.invocations())
        .hasSize(2)
        .allSatisfy(i -> assertThat(i.environment()).containsEntry("GIT_TERMINAL_PROMPT", "0"));
  }

  @Test
  void failedHeadsListingIsRaised() {
    runner.onExit("git ls-remote --heads", 128, "", "fatal: Authentication failed");

    assertThatThrownBy(() -> service.fetchRemoteBranches(URL))
        .isInstanceOf(GitCommandException.class)
        .hasMessageContaining("Authentication failed");
  }

  @Test
  void resolveDefaultBranchOrder() {
    assertThat(RemoteBranchService.resolveDefaultBranch(List.of("x", "trunk", "develop"), null))
        .isEqualTo("develop");
    assertThat(RemoteBranchService.resolveDefaultBranch(List.of("x", "y"), "missing"))
        .isEqualTo("x");
    assertThat(RemoteBranchService.resolveDefaultBranch(List.of(), null)).isEmpty();
  }

  @Test
  void parseSymrefIgnoresNonRefLines() {
    assertThat(RemoteBranchService.parseSymref("abc\tHEAD\n")).isNull();
    assertThat(RemoteBranchService.parseSymref("ref: refs/heads/dev\tHEAD\n")).isEqualTo("dev");
  }
}
