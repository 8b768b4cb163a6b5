package com.acme.delivery.repository;

import com.acme.delivery.domain.FailedMessage;
import com.acme.delivery.domain.RetryPointer;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value storage for failed messages, split into three partitions:
 * - active: messages awaiting a scheduled retry
 * - permanent: messages whose retry budget is exhausted; never retried automatically
 * - retry-schedule: lightweight {@link RetryPointer}s scanned by the retry scheduler
 *
 * <p>Every write carries a TTL; expiry is the store's job. Claim markers provide the per-message
 * exclusivity that keeps the scheduler and a manual retry from delivering the same message twice.
 */
public interface DeadLetterStore {

  /** Upserts into the active partition. */
  void put(FailedMessage message, Duration ttl);

  Optional<FailedMessage> get(String queue, String id);

  /** Deletes from the active partition only. */
  boolean delete(String queue, String id);

  /** Writes to the permanent partition and removes any active copy. */
  void movePermanent(FailedMessage message, Duration ttl);

  /** Upserts into the permanent partition without touching the active one. */
  void putPermanent(FailedMessage message, Duration ttl);

  Optional<FailedMessage> getPermanent(String queue, String id);

  boolean deletePermanent(String queue, String id);

  long countPermanent(String queue);

  void putRetryPointer(RetryPointer pointer, Duration ttl);

  List<RetryPointer> listRetryPointers();

  Optional<RetryPointer> getRetryPointer(String queue, String id);

  boolean deleteRetryPointer(String queue, String id);

  /**
   * Sets the claim marker for the message if no other claim is live.
   *
   * @return true if this caller now holds the claim
   */
  boolean tryClaim(String queue, String id, String owner, Duration ttl);

  void releaseClaim(String queue, String id);

  /** Lists keys matching a glob pattern. O(total keys); meant for stats and diagnostics. */
  List<String> listByPrefix(String pattern);
}
