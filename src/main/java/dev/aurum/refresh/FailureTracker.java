package dev.aurum.refresh;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-alias consecutive failure counters and re-clone cooldowns. In memory only; a restart starts
 * every alias from zero.
 */
public class FailureTracker {

  private final Clock clock;
  private final ConcurrentHashMap<String, AtomicInteger> failures = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> cooldownUntil = new ConcurrentHashMap<>();

  public FailureTracker(Clock clock) {
    this.clock = clock;
  }

  /** Increments the counter for {@code alias} and returns the new value. */
  public int recordFailure(String alias) {
    return failures.computeIfAbsent(alias, a -> new AtomicInteger()).incrementAndGet();
  }

  public void reset(String alias) {
    AtomicInteger counter = failures.get(alias);
    if (counter != null) {
      counter.set(0);
    }
  }

  public int getFailureCount(String alias) {
    AtomicInteger counter = failures.get(alias);
    return counter == null ? 0 : counter.get();
  }

  /** Blocks destructive recovery for {@code alias} until {@code duration} from now. */
  public void startCooldown(String alias, Duration duration) {
    cooldownUntil.put(alias, clock.instant().plus(duration));
  }

  public boolean isInCooldown(String alias) {
    Instant until = cooldownUntil.get(alias);
    return until != null && clock.instant().isBefore(until);
  }

  public Optional<Instant> getCooldownUntil(String alias) {
    return Optional.ofNullable(cooldownUntil.get(alias));
  }
}
