package com.acme.delivery.retry;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff: {@code baseDelay * backoffFactor^(attempt-1)}, capped at {@code maxDelay}.
 * With jitter the capped delay moves by a uniform offset within +/-25%, and the result is clamped
 * back into {@code [0, maxDelay]}.
 */
public class BackoffCalculator {

  static final double JITTER_RATIO = 0.25;

  private final Random random;

  public BackoffCalculator() {
    this(new Random());
  }

  /** @param random source for jitter; pass a seeded instance for reproducible delays */
  public BackoffCalculator(Random random) {
    this.random = random;
  }

  public Duration delay(int attempt, BackoffSettings policy) {
    int exponent = Math.max(1, attempt) - 1;
    double maxMillis = policy.getMaxDelay().toMillis();
    double millis = policy.getBaseDelay().toMillis() * Math.pow(policy.getBackoffFactor(), exponent);
    millis = Math.min(millis, maxMillis);

    if (policy.isJitter()) {
      double range = millis * JITTER_RATIO;
      millis += (random.nextDouble() * 2 - 1) * range;
      millis = Math.min(millis, maxMillis);
    }

    return Duration.ofMillis((long) Math.floor(Math.max(0, millis)));
  }
}
