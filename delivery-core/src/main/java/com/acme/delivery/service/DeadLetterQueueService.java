package com.acme.delivery.service;

import com.acme.delivery.config.DlqConfig;
import com.acme.delivery.config.DlqConfigOverrides;
import com.acme.delivery.domain.DlqStats;
import java.util.Map;
import java.util.Optional;

/**
 * Dead letter queue for background jobs that failed all in-process attempts. Admitted messages are
 * re-delivered to their origin queue on an exponential schedule until the queue's retry budget is
 * spent, then parked as permanent for manual handling.
 *
 * <p>Implementations never propagate store or telemetry failures; they are logged and reported
 * through the return value.
 */
public interface DeadLetterQueueService {

  /**
   * Records a failed message.
   *
   * @param currentRetryCount re-deliveries already spent on this message
   * @param overrides per-call config, layered over the queue's registered config; may be null
   * @param metadata caller context such as correlation or user ids; may be null
   * @return the generated id, or empty if the record could not be stored
   */
  Optional<String> admitFailure(
      String queue,
      String payload,
      Throwable error,
      int currentRetryCount,
      DlqConfigOverrides overrides,
      Map<String, String> metadata);

  default Optional<String> admitFailure(String queue, String payload, Throwable error) {
    return admitFailure(queue, payload, error, 0, null, null);
  }

  /**
   * Re-publishes a message now, whether active or permanent. Returns false if the message does not
   * exist or is being re-delivered by someone else.
   */
  boolean retryMessage(String queue, String id);

  /** Removes the message from every partition. Returns true if anything was removed. */
  boolean deleteMessage(String queue, String id);

  DlqStats getStats(Optional<String> queue);

  DlqConfig configureQueue(String queue, DlqConfigOverrides overrides);
}
