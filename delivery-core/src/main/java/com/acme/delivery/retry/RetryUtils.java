package com.acme.delivery.retry;

import com.acme.delivery.core.TransientException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class RetryUtils {

  private RetryUtils() {
    // Utility class - no instantiation
  }

  /**
   * Races {@code operation} (run on {@code workers}) against {@code timeout}. On expiry the
   * operation is cancelled and a {@link TransientException} is thrown, so the retry engine treats
   * it as retryable.
   */
  public static <T> Callable<T> withTimeout(
      Callable<T> operation, Duration timeout, ExecutorService workers) {
    return withTimeout(operation, timeout, workers, "Operation timed out");
  }

  public static <T> Callable<T> withTimeout(
      Callable<T> operation, Duration timeout, ExecutorService workers, String timeoutMessage) {
    return () -> {
      Future<T> future = workers.submit(operation);
      try {
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new TransientException(timeoutMessage + " after " + timeout.toMillis() + " ms", e);
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw e;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception ex) {
          throw ex;
        }
        if (cause instanceof Error err) {
          throw err;
        }
        throw e;
      }
    };
  }
}
