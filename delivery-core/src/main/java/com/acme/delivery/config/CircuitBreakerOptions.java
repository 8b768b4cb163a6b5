package com.acme.delivery.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Overrides for a single circuit breaker; null fields keep the breaker's current value. */
@Value
@Builder
public class CircuitBreakerOptions {

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

  Integer failureThreshold;
  Duration recoveryTimeout;

  public static CircuitBreakerOptions none() {
    return CircuitBreakerOptions.builder().build();
  }
}
