package dev.aurum.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised configuration for the refresh engine.
 *
 * <p>Properties are bound from {@code aurum.*} in application.yml:
 *
 * <ul>
 *   <li>{@code golden-repos-dir} - root holding master clones, {@code .versioned/}, {@code
 *       aliases/} and {@code .locks/}
 *   <li>{@code refresh.*} - scheduler interval, worker pool size and queue capacity, re-clone
 *       threshold and cooldown
 *   <li>{@code cleanup.*} - how often queued snapshots are checked and how long they are kept
 *   <li>{@code indexer.*} - indexer executable and per-step timeouts, including the snapshot copy
 *   <li>{@code git.*} - per-command git timeouts and ls-remote retry settings
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if durations are
 * not positive.
 */
@Validated
@Configuration
@ConfigurationProperties(prefix = "aurum")
public class AurumProperties {

  @NotNull
  private Path goldenReposDir = Path.of(System.getProperty("user.home"), ".aurum", "golden-repos");

  @Valid private final Refresh refresh = new Refresh();
  @Valid private final Cleanup cleanup = new Cleanup();
  @Valid private final Indexer indexer = new Indexer();
  @Valid private final Git git = new Git();

  /** Validates configuration at startup. Throws if a duration is zero or negative. */
  @PostConstruct
  void validate() {
    requirePositive("aurum.refresh.interval", refresh.interval);
    requirePositive("aurum.refresh.reclone-cooldown", refresh.recloneCooldown);
    requirePositive("aurum.refresh.shutdown-timeout", refresh.shutdownTimeout);
    requirePositive("aurum.cleanup.check-interval", cleanup.checkInterval);
    if (cleanup.gracePeriod.isNegative()) {
      throw new IllegalStateException(
          "aurum.cleanup.grace-period must not be negative, got: " + cleanup.gracePeriod);
    }
    requirePositive("aurum.indexer.index-timeout", indexer.indexTimeout);
    requirePositive("aurum.indexer.temporal-timeout", indexer.temporalTimeout);
    requirePositive("aurum.indexer.scip-timeout", indexer.scipTimeout);
    requirePositive("aurum.indexer.fix-config-timeout", indexer.fixConfigTimeout);
    requirePositive("aurum.indexer.copy-timeout", indexer.copyTimeout);
    requirePositive("aurum.git.fetch-timeout", git.fetchTimeout);
    requirePositive("aurum.git.pull-timeout", git.pullTimeout);
    requirePositive("aurum.git.clone-timeout", git.cloneTimeout);
    requirePositive("aurum.git.command-timeout", git.commandTimeout);
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalStateException(name + " must be a positive duration, got: " + value);
    }
  }

  public Path getGoldenReposDir() {
    return goldenReposDir;
  }

  public void setGoldenReposDir(Path goldenReposDir) {
    this.goldenReposDir = goldenReposDir;
  }

  public Refresh getRefresh() {
    return refresh;
  }

  public Cleanup getCleanup() {
    return cleanup;
  }

  public Indexer getIndexer() {
    return indexer;
  }

  public Git getGit() {
    return git;
  }

  public static class Refresh {

    private Duration interval = Duration.ofMinutes(10);

    @Min(1)
    private int workerThreads = 4;

    @Min(1)
    private int queueCapacity = 100;

    @Min(1)
    private int recloneThreshold = 3;

    private Duration recloneCooldown = Duration.ofMinutes(30);
    private Duration shutdownTimeout = Duration.ofMinutes(2);

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getWorkerThreads() {
      return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getRecloneThreshold() {
      return recloneThreshold;
    }

    public void setRecloneThreshold(int recloneThreshold) {
      this.recloneThreshold = recloneThreshold;
    }

    public Duration getRecloneCooldown() {
      return recloneCooldown;
    }

    public void setRecloneCooldown(Duration recloneCooldown) {
      this.recloneCooldown = recloneCooldown;
    }

    public Duration getShutdownTimeout() {
      return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
    }
  }

  public static class Cleanup {

    private Duration checkInterval = Duration.ofSeconds(60);
    private Duration gracePeriod = Duration.ofMinutes(5);

    public Duration getCheckInterval() {
      return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
    }

    public Duration getGracePeriod() {
      return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
      this.gracePeriod = gracePeriod;
    }
  }

  public static class Indexer {

    @NotBlank private String command = "cidx";

    private Duration indexTimeout = Duration.ofHours(1);
    private Duration temporalTimeout = Duration.ofHours(2);
    private Duration scipTimeout = Duration.ofHours(1);
    private Duration fixConfigTimeout = Duration.ofMinutes(2);
    private Duration copyTimeout = Duration.ofHours(1);

    public String getCommand() {
      return command;
    }

    public void setCommand(String command) {
      this.command = command;
    }

    public Duration getIndexTimeout() {
      return indexTimeout;
    }

    public void setIndexTimeout(Duration indexTimeout) {
      this.indexTimeout = indexTimeout;
    }

    public Duration getTemporalTimeout() {
      return temporalTimeout;
    }

    public void setTemporalTimeout(Duration temporalTimeout) {
      this.temporalTimeout = temporalTimeout;
    }

    public Duration getScipTimeout() {
      return scipTimeout;
    }

    public void setScipTimeout(Duration scipTimeout) {
      this.scipTimeout = scipTimeout;
    }

    public Duration getFixConfigTimeout() {
      return fixConfigTimeout;
    }

    public void setFixConfigTimeout(Duration fixConfigTimeout) {
      this.fixConfigTimeout = fixConfigTimeout;
    }

    public Duration getCopyTimeout() {
      return copyTimeout;
    }

    public void setCopyTimeout(Duration copyTimeout) {
      this.copyTimeout = copyTimeout;
    }
  }

  public static class Git {

    private Duration fetchTimeout = Duration.ofMinutes(5);
    private Duration pullTimeout = Duration.ofMinutes(5);
    private Duration cloneTimeout = Duration.ofMinutes(30);
    private Duration commandTimeout = Duration.ofMinutes(1);

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public Duration getPullTimeout() {
      return pullTimeout;
    }

    public void setPullTimeout(Duration pullTimeout) {
      this.pullTimeout = pullTimeout;
    }

    public Duration getCloneTimeout() {
      return cloneTimeout;
    }

    public void setCloneTimeout(Duration cloneTimeout) {
      this.cloneTimeout = cloneTimeout;
    }

    public Duration getCommandTimeout() {
      return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
      this.commandTimeout = commandTimeout;
    }
  }
}
