package com.acme.delivery.processor.config;

import com.acme.delivery.circuit.CircuitBreakerRegistry;
import com.acme.delivery.config.DeliveryConfig;
import com.acme.delivery.config.DlqConfigRegistry;
import com.acme.delivery.metrics.DeliveryMetrics;
import com.acme.delivery.retry.BackoffCalculator;
import com.acme.delivery.retry.RetryExecutor;
import com.acme.delivery.retry.RetryableErrorClassifier;
import com.acme.delivery.retry.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>This factory bridges the gap between framework-agnostic core POJOs and Micronaut's dependency
 * injection system. The core module remains free of framework dependencies, while this processor
 * module handles the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  static final String RETRY_TIMER = "retry-timer";

  /** Creates DeliveryConfig bean populated from application.yml delivery.* properties */
  @Singleton
  @ConfigurationProperties("delivery")
  public DeliveryConfig deliveryConfig() {
    return new DeliveryConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Fallback when no Micrometer registry is provided by the application */
  @Singleton
  @Requires(missingBeans = MeterRegistry.class)
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Singleton
  public DeliveryMetrics deliveryMetrics(MeterRegistry registry) {
    return new DeliveryMetrics(registry);
  }

  @Singleton
  public CircuitBreakerRegistry circuitBreakerRegistry(DeliveryConfig config, Clock clock) {
    return new CircuitBreakerRegistry(config.getCircuitBreaker().toOptions(), clock);
  }

  @Singleton
  public BackoffCalculator backoffCalculator() {
    return new BackoffCalculator();
  }

  @Singleton
  public DlqConfigRegistry dlqConfigRegistry(DeliveryConfig config) {
    return new DlqConfigRegistry(config.getDlq().toDlqConfig());
  }

  /** Timer for the non-blocking retry path; only waits run here, never the operations. */
  @Singleton
  @Named(RETRY_TIMER)
  @Bean(preDestroy = "shutdownNow")
  public ScheduledExecutorService retryTimer() {
    return Executors.newSingleThreadScheduledExecutor(
        r -> {
          Thread t = new Thread(r, RETRY_TIMER);
          t.setDaemon(true);
          return t;
        });
  }

  @Singleton
  public RetryExecutor retryExecutor(
      CircuitBreakerRegistry circuitBreakers,
      BackoffCalculator backoff,
      DeliveryMetrics metrics,
      @Named(RETRY_TIMER) ScheduledExecutorService timer,
      DeliveryConfig config) {
    return new RetryExecutor(
        circuitBreakers,
        backoff,
        new RetryableErrorClassifier(),
        metrics,
        Sleeper.THREAD,
        timer,
        config.getRetry().toRetryPolicy());
  }
}
