package com.acme.delivery.core;

/**
 * Raised instead of invoking an operation whose circuit breaker is open. The operation was not
 * attempted at all.
 */
public class CircuitBreakerOpenException extends RuntimeException {
  private final String operationName;

  public CircuitBreakerOpenException(String operationName) {
    super("Circuit breaker is open for " + operationName);
    this.operationName = operationName;
  }

  public String getOperationName() {
    return operationName;
  }
}
