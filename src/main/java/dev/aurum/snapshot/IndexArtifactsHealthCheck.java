package dev.aurum.snapshot;

import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Default health check: the snapshot must carry a semantic or full-text index. */
@Component
public class IndexArtifactsHealthCheck implements RepositoryHealthCheck {

  @Override
  public boolean isHealthy(Path snapshotPath) {
    IndexArtifacts artifacts = IndexArtifacts.detect(snapshotPath);
    return artifacts.semantic() || artifacts.fts();
  }
}
