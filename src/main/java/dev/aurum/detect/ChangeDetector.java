package dev.aurum.detect;

import java.nio.file.Path;

/** Answers whether a golden repo's source has content newer than its last published version. */
public interface ChangeDetector {

  /**
   * @param sourcePath the working copy to inspect (master clone or live directory)
   * @param alias the golden repo alias
   * @return true if a refresh should index and publish a new version
   */
  boolean hasChanges(Path sourcePath, String alias);
}
