package com.acme.delivery.circuit;

import com.acme.delivery.config.CircuitBreakerOptions;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory circuit breakers keyed by operation name. State is not persisted and does not survive
 * a restart. Each breaker is created on first recorded outcome (or explicit configure) with the
 * registry's default options.
 */
public class CircuitBreakerRegistry {

  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final CircuitBreakerOptions defaults;
  private final Clock clock;

  public CircuitBreakerRegistry() {
    this(CircuitBreakerOptions.none(), Clock.systemUTC());
  }

  public CircuitBreakerRegistry(CircuitBreakerOptions defaults, Clock clock) {
    this.defaults = defaults;
    this.clock = clock;
  }

  /**
   * True only if the breaker is OPEN and the recovery timeout has not elapsed. Checking an OPEN
   * breaker past its timeout moves it to HALF_OPEN and returns false.
   */
  public boolean isOpen(String operationName) {
    CircuitBreaker breaker = breakers.get(operationName);
    return breaker != null && breaker.isOpen(clock.instant());
  }

  public void recordSuccess(String operationName) {
    getOrCreate(operationName).recordSuccess();
  }

  public void recordFailure(String operationName) {
    getOrCreate(operationName).recordFailure(clock.instant());
  }

  public void configure(String operationName, CircuitBreakerOptions options) {
    getOrCreate(operationName).apply(options);
  }

  public Optional<CircuitBreakerSnapshot> snapshot(String operationName) {
    return Optional.ofNullable(breakers.get(operationName)).map(CircuitBreaker::snapshot);
  }

  /** Forgets the breaker; the next recorded outcome starts again from CLOSED. */
  public void reset(String operationName) {
    breakers.remove(operationName);
  }

  public Set<String> operationNames() {
    return Set.copyOf(breakers.keySet());
  }

  private CircuitBreaker getOrCreate(String operationName) {
    return breakers.computeIfAbsent(
        operationName,
        name -> {
          CircuitBreaker breaker = new CircuitBreaker(name);
          breaker.apply(defaults);
          return breaker;
        });
  }
}
