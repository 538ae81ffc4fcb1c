package dev.aurum.registry;

/** Where a golden repo's content comes from. */
public enum SourceKind {
  /** A remote git repository mirrored into a flat master clone. */
  GIT,
  /** A directory on the local filesystem, indexed in place. */
  LOCAL
}
