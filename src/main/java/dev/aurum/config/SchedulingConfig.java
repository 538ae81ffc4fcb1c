package dev.aurum.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Provides a system {@link Clock} bean for injectable time access, the thread pools behind the
 * refresh engine, and enables Spring Retry for {@code @Retryable} git remote calls.
 */
@Configuration
@EnableRetry
public class SchedulingConfig {

  private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Bounded pool that runs refreshes, sized by {@code aurum.refresh.worker-threads} and {@code
   * aurum.refresh.queue-capacity}. On shutdown, in-flight refreshes get up to {@code
   * aurum.refresh.shutdown-timeout} to finish.
   */
  @Bean
  public ThreadPoolTaskExecutor refreshWorkers(AurumProperties properties) {
    AurumProperties.Refresh refresh = properties.getRefresh();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(refresh.getWorkerThreads());
    executor.setMaxPoolSize(refresh.getWorkerThreads());
    executor.setQueueCapacity(refresh.getQueueCapacity());
    executor.setThreadNamePrefix("aurum-refresh-");
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(refresh.getShutdownTimeout().toMillis());
    log.info(
        "Refresh workers configured: threads={}, queue={}, shutdown timeout={}",
        refresh.getWorkerThreads(),
        refresh.getQueueCapacity(),
        refresh.getShutdownTimeout());
    return executor;
  }

  /** Drives the refresh dispatch loop and the snapshot cleanup pass, one thread each. */
  @Bean
  public ThreadPoolTaskScheduler loopScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("aurum-loop-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }
}
