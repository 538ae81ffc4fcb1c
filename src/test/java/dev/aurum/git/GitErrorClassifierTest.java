package dev.aurum.git;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GitErrorClassifierTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "error: Could not read pack index",
        "fatal: bad object refs/heads/main",
        "error: object file .git/objects/ab/cd is empty\nfatal: loose object abcd is corrupt",
        "fatal: not a git repository (or any of the parent directories): .git",
        "error: index file smaller than expected",
        "fatal: missing blob object 'e69de29'",
        "FATAL: PACKFILE .git/objects/pack/pack-1.pack CANNOT BE ACCESSED"
      })
  void corruptionMarkersClassifyAsCorruption(String stderr) {
    assertThat(GitErrorClassifier.classify(stderr)).isEqualTo(FailureCategory.CORRUPTION);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "fatal: unable to access 'https://github.com/x/y/': Could not resolve host: github.com",
        "ssh: connect to host example.com port 22: Connection refused",
        "fatal: the remote end hung up unexpectedly",
        "error: RPC failed; curl 56 GnuTLS recv error",
        "Operation timed out"
      })
  void networkFailuresClassifyAsTransient(String stderr) {
    assertThat(GitErrorClassifier.classify(stderr)).isEqualTo(FailureCategory.TRANSIENT);
    assertThat(GitErrorClassifier.isKnownNetworkFailure(stderr)).isTrue();
  }

  @Test
  void unrecognisedOutputDefaultsToTransient() {
    assertThat(GitErrorClassifier.classify("something odd happened"))
        .isEqualTo(FailureCategory.TRANSIENT);
    assertThat(GitErrorClassifier.isKnownNetworkFailure("something odd happened")).isFalse();
  }

  @Test
  void emptyOrNullStderrIsTransient() {
    assertThat(GitErrorClassifier.classify("")).isEqualTo(FailureCategory.TRANSIENT);
    assertThat(GitErrorClassifier.classify(null)).isEqualTo(FailureCategory.TRANSIENT);
  }

  @Test
  void corruptionWinsWhenBothKindsOfMarkerArePresent() {
    String stderr = "fatal: the remote end hung up unexpectedly\nerror: bad object HEAD";

    assertThat(GitErrorClassifier.classify(stderr)).isEqualTo(FailureCategory.CORRUPTION);
  }
}
