package com.acme.delivery.circuit;

import com.acme.delivery.config.CircuitBreakerOptions;
import java.time.Duration;
import java.time.Instant;

/**
 * State machine for one logical operation. All transitions happen under the instance lock, since
 * concurrent callers sharing an operation name race on the counters.
 *
 * <pre>
 * CLOSED --(failureCount &gt;= failureThreshold)--&gt; OPEN
 * OPEN --(recoveryTimeout elapsed, observed by isOpen)--&gt; HALF_OPEN
 * HALF_OPEN --(3 successes)--&gt; CLOSED
 * HALF_OPEN --(any failure)--&gt; OPEN
 * </pre>
 */
public class CircuitBreaker {

  public static final int SUCCESS_QUOTA = 3;

  private final String operationName;
  private CircuitStatus status = CircuitStatus.CLOSED;
  private int failureCount;
  private int successCount;
  private Instant lastFailureTime = Instant.EPOCH;
  private int failureThreshold = CircuitBreakerOptions.DEFAULT_FAILURE_THRESHOLD;
  private Duration recoveryTimeout = CircuitBreakerOptions.DEFAULT_RECOVERY_TIMEOUT;

  CircuitBreaker(String operationName) {
    this.operationName = operationName;
  }

  /** Returns true while open; moves OPEN to HALF_OPEN once the recovery timeout has elapsed. */
  synchronized boolean isOpen(Instant now) {
    if (status != CircuitStatus.OPEN) {
      return false;
    }
    if (Duration.between(lastFailureTime, now).compareTo(recoveryTimeout) < 0) {
      return true;
    }
    status = CircuitStatus.HALF_OPEN;
    successCount = 0;
    return false;
  }

  synchronized void recordSuccess() {
    if (status != CircuitStatus.HALF_OPEN) {
      return;
    }
    successCount++;
    if (successCount >= SUCCESS_QUOTA) {
      status = CircuitStatus.CLOSED;
      failureCount = 0;
      successCount = 0;
    }
  }

  synchronized void recordFailure(Instant now) {
    failureCount++;
    lastFailureTime = now;
    if (status == CircuitStatus.CLOSED && failureCount >= failureThreshold) {
      status = CircuitStatus.OPEN;
    } else if (status == CircuitStatus.HALF_OPEN) {
      status = CircuitStatus.OPEN;
      successCount = 0;
    }
  }

  synchronized void apply(CircuitBreakerOptions options) {
    if (options.getFailureThreshold() != null) {
      if (options.getFailureThreshold() < 1) {
        throw new IllegalArgumentException("failureThreshold must be >= 1");
      }
      failureThreshold = options.getFailureThreshold();
    }
    if (options.getRecoveryTimeout() != null) {
      if (options.getRecoveryTimeout().isNegative()) {
        throw new IllegalArgumentException("recoveryTimeout must be >= 0");
      }
      recoveryTimeout = options.getRecoveryTimeout();
    }
  }

  synchronized CircuitBreakerSnapshot snapshot() {
    return new CircuitBreakerSnapshot(
        operationName,
        status,
        failureCount,
        successCount,
        lastFailureTime,
        failureThreshold,
        recoveryTimeout);
  }
}
