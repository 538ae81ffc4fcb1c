package dev.aurum;

import static org.assertj.core.api.Assertions.assertThat;

import dev.aurum.cleanup.CleanupManager;
import dev.aurum.config.AurumProperties;
import dev.aurum.refresh.RefreshScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SmokeIT extends BaseIntegrationTest {

  @Autowired private AurumProperties properties;

  @Autowired private RefreshScheduler refreshScheduler;

  @Autowired private CleanupManager cleanupManager;

  @Test
  void contextLoadsWithBackgroundLoopsRunning() {
    // Flyway migrations applied, entities validated, lifecycle beans started
    assertThat(properties.getGoldenReposDir()).isEqualTo(GOLDEN_REPOS_DIR);
    assertThat(refreshScheduler.isRunning()).isTrue();
    assertThat(cleanupManager.isRunning()).isTrue();
  }
}
