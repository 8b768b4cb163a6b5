package com.acme.delivery.retry;

import com.acme.delivery.core.CircuitBreakerOpenException;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.TransientException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Decides whether an error is worth another attempt.
 *
 * <p>Retryable errors include:
 * - {@link TransientException} and network exceptions (connect, socket, DNS, timeout)
 * - messages naming connection resets, refusals, timeouts or DNS failures
 * - gateway style responses (502, 503, 504 and their reason phrases)
 *
 * <p>{@link PermanentException} and {@link CircuitBreakerOpenException} are never retryable;
 * anything not matched above is treated as permanent.
 */
public class RetryableErrorClassifier {

  private static final int MAX_CAUSE_DEPTH = 10;

  private static final List<Class<? extends Throwable>> RETRYABLE_TYPES =
      List.of(
          TransientException.class,
          ConnectException.class,
          SocketTimeoutException.class,
          SocketException.class,
          UnknownHostException.class,
          TimeoutException.class);

  private static final List<String> RETRYABLE_MESSAGES =
      List.of(
          "econnreset",
          "connection reset",
          "etimedout",
          "timed out",
          "timeout",
          "econnrefused",
          "connection refused",
          "enotfound",
          "eai_again",
          "unknown host",
          "network error",
          "service unavailable",
          "internal server error",
          "bad gateway",
          "gateway timeout");

  private static final Pattern GATEWAY_STATUS = Pattern.compile("\\b50[234]\\b");

  public boolean isRetryable(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause == null
        || cause instanceof PermanentException
        || cause instanceof CircuitBreakerOpenException) {
      return false;
    }

    Throwable current = cause;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (isRetryableType(current) || isRetryableMessage(current.getMessage())) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isRetryableType(Throwable error) {
    for (Class<? extends Throwable> type : RETRYABLE_TYPES) {
      if (type.isInstance(error)) {
        return true;
      }
    }
    return false;
  }

  private boolean isRetryableMessage(String message) {
    if (message == null || message.isEmpty()) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String fragment : RETRYABLE_MESSAGES) {
      if (lower.contains(fragment)) {
        return true;
      }
    }
    return GATEWAY_STATUS.matcher(lower).find();
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
