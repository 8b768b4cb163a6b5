package com.acme.delivery.circuit;

import java.time.Duration;
import java.time.Instant;

/** Point-in-time copy of a breaker's state, safe to hand out to callers. */
public record CircuitBreakerSnapshot(
    String operationName,
    CircuitStatus status,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    int failureThreshold,
    Duration recoveryTimeout) {}
