package dev.aurum.git;

import java.util.List;

/**
 * Branches advertised by a remote and the one it considers its default.
 *
 * @param branches branch names without the {@code refs/heads/} prefix, in ls-remote order
 * @param defaultBranch resolved default branch, or empty when the remote has no branches
 */
public record RemoteBranches(List<String> branches, String defaultBranch) {

  public RemoteBranches {
    branches = branches == null ? List.of() : List.copyOf(branches);
    defaultBranch = defaultBranch == null ? "" : defaultBranch;
  }
}
