package dev.aurum.git;

import java.util.Map;

/** Environment shared by git commands that talk to a remote. */
public final class GitEnvironment {

  /** Fails fast when a remote asks for credentials instead of waiting on a terminal prompt. */
  public static final Map<String, String> NO_PROMPT = Map.of("GIT_TERMINAL_PROMPT", "0");

  private GitEnvironment() {
    // constants only
  }
}
