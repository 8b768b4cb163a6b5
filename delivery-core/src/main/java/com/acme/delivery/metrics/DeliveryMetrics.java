package com.acme.delivery.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counter sink for the retry engine and the dead letter queue. Every increment lands on the
 * {@value #ERRORS} counter tagged with {@code error_type}, {@code component} and {@code severity}.
 * Recording never throws; registry failures are logged at WARN.
 */
public class DeliveryMetrics {
  private static final Logger LOG = LoggerFactory.getLogger(DeliveryMetrics.class);

  public static final String ERRORS = "delivery.errors";

  public static final String COMPONENT_RETRY = "retry_mechanism";
  public static final String COMPONENT_DLQ = "dead_letter_queue";

  private final MeterRegistry registry;

  public DeliveryMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  public void increment(String errorType, String component, String severity) {
    try {
      Counter.builder(ERRORS)
          .description("Retry, circuit breaker and dead letter outcomes")
          .tag("error_type", errorType)
          .tag("component", component)
          .tag("severity", severity)
          .register(registry)
          .increment();
    } catch (RuntimeException e) {
      LOG.warn("Failed to record metric error_type={} component={}: {}", errorType, component, e.getMessage());
    }
  }

  public void retryAttempt() {
    increment("retry_attempt", COMPONENT_RETRY, "info");
  }

  public void retryExhausted() {
    increment("retry_exhausted", COMPONENT_RETRY, "error");
  }

  public void circuitOpen() {
    increment("circuit_open", COMPONENT_RETRY, "warning");
  }

  public void dlqMessage() {
    increment("dlq_message", COMPONENT_DLQ, "warning");
  }

  public void dlqPermanent() {
    increment("dlq_permanent", COMPONENT_DLQ, "error");
  }

  public void dlqRetrySuccessful() {
    increment("retry_successful", COMPONENT_DLQ, "info");
  }

  public void dlqStoreFailure() {
    increment("dlq_store_failure", COMPONENT_DLQ, "error");
  }
}
