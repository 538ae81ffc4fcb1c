package dev.aurum.git;

import java.util.List;
import java.util.Locale;

/**
 * Static utility mapping git stderr output to a {@link FailureCategory}.
 *
 * <p>Matching is case-insensitive substring search. Corruption markers win over network markers
 * because a damaged repository often also reports a failed transfer. Anything unrecognised is
 * treated as transient.
 */
public final class GitErrorClassifier {

  private static final List<String> CORRUPTION_MARKERS =
      List.of(
          "pack index",
          "packfile",
          "pack file",
          "bad object",
          "corrupt",
          "loose object",
          "not a git repository",
          "missing blob",
          "missing tree",
          "missing commit",
          "index file smaller than expected",
          "bad signature",
          "unable to read tree",
          "invalid sha1 pointer",
          "broken link from",
          "object file",
          "did not send all necessary objects");

  private static final List<String> TRANSIENT_MARKERS =
      List.of(
          "could not resolve host",
          "connection refused",
          "connection timed out",
          "connection reset",
          "operation timed out",
          "timed out",
          "network is unreachable",
          "temporary failure in name resolution",
          "could not read from remote repository",
          "the remote end hung up unexpectedly",
          "early eof",
          "rpc failed",
          "ssl",
          "gnutls",
          "http 5",
          "returned error: 5",
          "too many requests");

  private GitErrorClassifier() {
    // utility class
  }

  /**
   * Classifies the stderr of a failed git command.
   *
   * @param stderr raw standard error, may be null or empty
   * @return {@link FailureCategory#CORRUPTION} for object-store damage, otherwise {@link
   *     FailureCategory#TRANSIENT}
   */
  public static FailureCategory classify(String stderr) {
    if (stderr == null || stderr.isBlank()) {
      return FailureCategory.TRANSIENT;
    }
    String normalized = stderr.toLowerCase(Locale.ROOT);
    for (String marker : CORRUPTION_MARKERS) {
      if (normalized.contains(marker)) {
        return FailureCategory.CORRUPTION;
      }
    }
    return FailureCategory.TRANSIENT;
  }

  /** True when the stderr matches a known network failure. Used for log wording only. */
  public static boolean isKnownNetworkFailure(String stderr) {
    if (stderr == null) {
      return false;
    }
    String normalized = stderr.toLowerCase(Locale.ROOT);
    return TRANSIENT_MARKERS.stream().anyMatch(normalized::contains);
  }
}
