package com.acme.delivery.config;

import com.acme.delivery.retry.RetryPolicy;
import java.time.Duration;

/**
 * Configuration for retry defaults, circuit breaker defaults, dead letter defaults and the retry
 * scheduler. Pure POJO - no framework dependencies.
 */
public class DeliveryConfig {

  private Scheduler scheduler = new Scheduler();
  private Dlq dlq = new Dlq();
  private Retry retry = new Retry();
  private CircuitBreaker circuitBreaker = new CircuitBreaker();

  public Scheduler getScheduler() {
    return scheduler;
  }

  public void setScheduler(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  public Dlq getDlq() {
    return dlq;
  }

  public void setDlq(Dlq dlq) {
    this.dlq = dlq;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
  }

  public static class Scheduler {
    private boolean enabled = true;
    private Duration scanInterval = Duration.ofSeconds(30);
    private Duration cleanupInterval = Duration.ofHours(24);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getScanInterval() {
      return scanInterval;
    }

    public void setScanInterval(Duration scanInterval) {
      this.scanInterval = scanInterval;
    }

    public Duration getCleanupInterval() {
      return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
    }
  }

  public static class Dlq {
    private int maxRetries = 5;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofHours(1);
    private double backoffFactor = 2.0;
    private boolean enableJitter = true;
    private Duration retentionPeriod = Duration.ofDays(7);
    private int alertThreshold = 10;
    private Duration claimTtl = Duration.ofSeconds(30); // exclusivity window for a re-delivery

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public double getBackoffFactor() {
      return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
      this.backoffFactor = backoffFactor;
    }

    public boolean isEnableJitter() {
      return enableJitter;
    }

    public void setEnableJitter(boolean enableJitter) {
      this.enableJitter = enableJitter;
    }

    public Duration getRetentionPeriod() {
      return retentionPeriod;
    }

    public void setRetentionPeriod(Duration retentionPeriod) {
      this.retentionPeriod = retentionPeriod;
    }

    public int getAlertThreshold() {
      return alertThreshold;
    }

    public void setAlertThreshold(int alertThreshold) {
      this.alertThreshold = alertThreshold;
    }

    public Duration getClaimTtl() {
      return claimTtl;
    }

    public void setClaimTtl(Duration claimTtl) {
      this.claimTtl = claimTtl;
    }

    public DlqConfig toDlqConfig() {
      return DlqConfig.builder()
          .maxRetries(maxRetries)
          .baseDelay(baseDelay)
          .maxDelay(maxDelay)
          .backoffFactor(backoffFactor)
          .enableJitter(enableJitter)
          .retentionPeriod(retentionPeriod)
          .alertThreshold(alertThreshold)
          .build();
    }
  }

  public static class Retry {
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
    private double backoffFactor = RetryPolicy.DEFAULT_BACKOFF_FACTOR;
    private boolean jitter = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public double getBackoffFactor() {
      return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
      this.backoffFactor = backoffFactor;
    }

    public boolean isJitter() {
      return jitter;
    }

    public void setJitter(boolean jitter) {
      this.jitter = jitter;
    }

    public RetryPolicy toRetryPolicy() {
      return RetryPolicy.builder()
          .maxAttempts(maxAttempts)
          .baseDelay(baseDelay)
          .maxDelay(maxDelay)
          .backoffFactor(backoffFactor)
          .jitter(jitter)
          .build();
    }
  }

  public static class CircuitBreaker {
    private int failureThreshold = CircuitBreakerOptions.DEFAULT_FAILURE_THRESHOLD;
    private Duration recoveryTimeout = CircuitBreakerOptions.DEFAULT_RECOVERY_TIMEOUT;

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getRecoveryTimeout() {
      return recoveryTimeout;
    }

    public void setRecoveryTimeout(Duration recoveryTimeout) {
      this.recoveryTimeout = recoveryTimeout;
    }

    public CircuitBreakerOptions toOptions() {
      return CircuitBreakerOptions.builder()
          .failureThreshold(failureThreshold)
          .recoveryTimeout(recoveryTimeout)
          .build();
    }
  }
}
