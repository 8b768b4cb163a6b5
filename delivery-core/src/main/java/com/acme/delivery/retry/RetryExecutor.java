package com.acme.delivery.retry;

import com.acme.delivery.circuit.CircuitBreakerRegistry;
import com.acme.delivery.config.CircuitBreakerOptions;
import com.acme.delivery.core.CircuitBreakerOpenException;
import com.acme.delivery.metrics.DeliveryMetrics;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation under a {@link RetryPolicy}, guarded by the operation's circuit breaker.
 *
 * <p>Attempts are strictly sequential. An open breaker short-circuits the whole call with {@link
 * CircuitBreakerOpenException}. Only the last attempt's error is propagated; earlier errors are
 * logged and dropped. There is no wall-clock limit on the operation itself; wrap it with {@link
 * RetryUtils#withTimeout} first if one is needed.
 */
public class RetryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

  static final String TIMEOUT_RETRY_OPERATION = "timeout_retry_operation";

  private final CircuitBreakerRegistry circuitBreakers;
  private final BackoffCalculator backoff;
  private final RetryableErrorClassifier classifier;
  private final DeliveryMetrics metrics;
  private final Sleeper sleeper;
  private final ScheduledExecutorService timer;
  private final RetryPolicy defaultPolicy;

  public RetryExecutor(
      CircuitBreakerRegistry circuitBreakers,
      BackoffCalculator backoff,
      RetryableErrorClassifier classifier,
      DeliveryMetrics metrics,
      Sleeper sleeper,
      ScheduledExecutorService timer,
      RetryPolicy defaultPolicy) {
    this.circuitBreakers = circuitBreakers;
    this.backoff = backoff;
    this.classifier = classifier;
    this.metrics = metrics;
    this.sleeper = sleeper;
    this.timer = timer;
    this.defaultPolicy = defaultPolicy;
  }

  public <T> T executeWithRetry(Callable<T> operation, String operationName) throws Exception {
    return executeWithRetry(operation, defaultPolicy, operationName);
  }

  public <T> T executeWithRetry(Callable<T> operation, RetryPolicy policy, String operationName)
      throws Exception {
    Exception lastError = null;
    int attempt = 1;
    for (; attempt <= policy.getMaxAttempts(); attempt++) {
      checkCircuit(operationName);
      try {
        T result = operation.call();
        circuitBreakers.recordSuccess(operationName);
        return result;
      } catch (Exception e) {
        lastError = e;
        circuitBreakers.recordFailure(operationName);
        if (!shouldRetry(e, attempt, policy)) {
          break;
        }
        Duration delay = scheduleNext(operationName, attempt, policy, e);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          LOG.warn("Retry of {} interrupted after attempt {}", operationName, attempt);
          e.addSuppressed(ie);
          break;
        }
      }
    }
    exhausted(operationName, Math.min(attempt, policy.getMaxAttempts()), lastError);
    throw lastError;
  }

  /**
   * Non-blocking variant: the wait between attempts runs on the timer executor, so the calling
   * thread returns immediately. The returned future fails with the last attempt's error.
   */
  public <T> CompletableFuture<T> executeWithRetryAsync(
      Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy, String operationName) {
    CompletableFuture<T> result = new CompletableFuture<>();
    attemptAsync(operation, policy, operationName, 1, result);
    return result;
  }

  /** Returns a callable that runs {@code operation} through {@link #executeWithRetry}. */
  public <T> Callable<T> withRetry(RetryPolicy policy, String operationName, Callable<T> operation) {
    return () -> executeWithRetry(operation, policy, operationName);
  }

  /**
   * Returns a callable guarded only by the circuit breaker: a single attempt, rejected while the
   * breaker is open.
   */
  public <T> Callable<T> withCircuitBreaker(
      String operationName, CircuitBreakerOptions options, Callable<T> operation) {
    circuitBreakers.configure(operationName, options);
    return () -> executeWithRetry(operation, RetryPolicy.noRetry(), operationName);
  }

  /** Each attempt is raced against {@code timeout}; a timed out attempt counts as transient. */
  public <T> T withTimeoutAndRetry(
      Callable<T> operation, Duration timeout, RetryPolicy policy, ExecutorService workers)
      throws Exception {
    return executeWithRetry(
        RetryUtils.withTimeout(operation, timeout, workers), policy, TIMEOUT_RETRY_OPERATION);
  }

  public void configureCircuitBreaker(String operationName, CircuitBreakerOptions options) {
    circuitBreakers.configure(operationName, options);
  }

  public RetryPolicy getDefaultPolicy() {
    return defaultPolicy;
  }

  private <T> void attemptAsync(
      Supplier<? extends CompletionStage<T>> operation,
      RetryPolicy policy,
      String operationName,
      int attempt,
      CompletableFuture<T> result) {
    try {
      checkCircuit(operationName);
    } catch (CircuitBreakerOpenException e) {
      result.completeExceptionally(e);
      return;
    }

    CompletionStage<T> stage;
    try {
      stage = operation.get();
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }

    stage.whenComplete(
        (value, error) -> {
          if (error == null) {
            circuitBreakers.recordSuccess(operationName);
            result.complete(value);
            return;
          }
          Throwable cause = RetryableErrorClassifier.unwrap(error);
          circuitBreakers.recordFailure(operationName);
          if (!shouldRetry(cause, attempt, policy)) {
            exhausted(operationName, attempt, cause);
            result.completeExceptionally(cause);
            return;
          }
          Duration delay = scheduleNext(operationName, attempt, policy, cause);
          try {
            timer.schedule(
                () -> attemptAsync(operation, policy, operationName, attempt + 1, result),
                delay.toMillis(),
                TimeUnit.MILLISECONDS);
          } catch (RuntimeException e) {
            cause.addSuppressed(e);
            exhausted(operationName, attempt, cause);
            result.completeExceptionally(cause);
          }
        });
  }

  private void checkCircuit(String operationName) {
    if (circuitBreakers.isOpen(operationName)) {
      metrics.circuitOpen();
      LOG.warn("Circuit breaker is open for {}, rejecting call", operationName);
      throw new CircuitBreakerOpenException(operationName);
    }
  }

  private boolean shouldRetry(Throwable error, int attempt, RetryPolicy policy) {
    if (attempt >= policy.getMaxAttempts()) {
      return false;
    }
    if (policy.getRetryPredicate().map(p -> !p.test(error)).orElse(false)) {
      return false;
    }
    return classifier.isRetryable(error);
  }

  private Duration scheduleNext(String operationName, int attempt, RetryPolicy policy, Throwable error) {
    Duration delay = backoff.delay(attempt, policy);
    metrics.retryAttempt();
    LOG.info(
        "Retrying operation {} (attempt {}/{}) in {} ms: {}",
        operationName,
        attempt,
        policy.getMaxAttempts(),
        delay.toMillis(),
        error.getMessage());
    return delay;
  }

  private void exhausted(String operationName, int attempts, Throwable lastError) {
    metrics.retryExhausted();
    LOG.error("Operation {} failed after {} attempt(s): {}", operationName, attempts, lastError.getMessage(), lastError);
  }
}
