package com.acme.delivery.retry;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable retry policy for {@link RetryExecutor}. Unset builder fields take the defaults below;
 * invalid values are rejected by {@code build()}.
 *
 * <p>Example:
 *
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(10))
 *     .retryPredicate(e -&gt; !(e instanceof IllegalArgumentException))
 *     .build();
 * </pre>
 */
@Value
public class RetryPolicy implements BackoffSettings {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
  public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

  /** Total attempts including the first call. */
  int maxAttempts;

  Duration baseDelay;
  Duration maxDelay;
  double backoffFactor;
  boolean jitter;

  /** Extra filter on top of the built-in retryable classification. */
  Predicate<Throwable> retryPredicate;

  @Builder(toBuilder = true)
  private RetryPolicy(
      Integer maxAttempts,
      Duration baseDelay,
      Duration maxDelay,
      Double backoffFactor,
      Boolean jitter,
      Predicate<Throwable> retryPredicate) {
    this.maxAttempts = maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
    this.baseDelay = baseDelay != null ? baseDelay : DEFAULT_BASE_DELAY;
    this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
    this.backoffFactor = backoffFactor != null ? backoffFactor : DEFAULT_BACKOFF_FACTOR;
    this.jitter = jitter == null || jitter;
    this.retryPredicate = retryPredicate;

    if (this.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (this.baseDelay.isNegative() || this.maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must be >= 0");
    }
    if (this.backoffFactor < 1.0 || Double.isNaN(this.backoffFactor)) {
      throw new IllegalArgumentException("backoffFactor must be >= 1.0");
    }
    if (this.maxDelay.compareTo(this.baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
  }

  /** 3 attempts, 1s base delay doubling up to 30s, with jitter. */
  public static RetryPolicy defaultPolicy() {
    return builder().build();
  }

  /** Single attempt; used when only the circuit breaker should guard a call. */
  public static RetryPolicy noRetry() {
    return builder().maxAttempts(1).build();
  }

  public Optional<Predicate<Throwable>> getRetryPredicate() {
    return Optional.ofNullable(retryPredicate);
  }
}
