package com.acme.delivery.persistence.redis;

import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.TransientException;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;
import org.slf4j.Logger;

import java.util.List;
import java.util.Locale;

/**
 * Utility class for translating Redisson exceptions to domain exceptions.
 * Determines whether a Redis failure is permanent (non-retryable) or transient (retryable).
 */
public final class RedisExceptionTranslator {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "loading", "busy", "tryagain", "masterdown", "readonly",
            "timeout", "timed out", "connection", "unable to connect", "shutdown");

    private static final List<String> PERMANENT_MARKERS = List.of(
            "wrongtype", "noauth", "wrongpass", "noperm", "unknown command", "syntax error");

    private RedisExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a Redisson failure to either PermanentException or TransientException.
     *
     * @param originalException The exception raised by Redisson
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     * @return PermanentException for non-retryable errors, TransientException for retryable ones
     */
    public static RuntimeException translateException(
            RedisException originalException, String operation, Logger logger) {

        logger.error("Redis operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient Redis error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent Redis error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // Default to TransientException when in doubt
        return new TransientException(
                String.format("Redis error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    static boolean isTransientError(RedisException exception) {
        if (exception instanceof RedisTimeoutException || exception instanceof RedisConnectionException) {
            return true;
        }
        String message = lower(exception);
        return TRANSIENT_MARKERS.stream().anyMatch(message::contains);
    }

    static boolean isPermanentError(RedisException exception) {
        String message = lower(exception);
        return PERMANENT_MARKERS.stream().anyMatch(message::contains);
    }

    private static String lower(RedisException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
