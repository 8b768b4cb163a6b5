package com.acme.delivery.processor;

import com.acme.delivery.config.DeliveryConfig;
import com.acme.delivery.config.DlqConfigRegistry;
import com.acme.delivery.domain.DlqStats;
import com.acme.delivery.domain.FailedMessage;
import com.acme.delivery.domain.RetryPointer;
import com.acme.delivery.event.DlqEvent;
import com.acme.delivery.event.DlqEventType;
import com.acme.delivery.metrics.DeliveryMetrics;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.service.DeadLetterQueueService;
import com.acme.delivery.spi.QueuePublisher;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventPublisher;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loops of the dead letter queue: re-delivers messages whose retry pointer is due, and
 * runs a periodic audit that logs stats and drops orphaned pointers.
 *
 * <p>Both loops are Micronaut {@link Scheduled} ticks, registered when the context starts.
 * {@link #stop()} pauses them and {@link #start()} resumes them. Each pointer is handled under
 * a claim marker and is re-read once claimed, so a concurrent manual retry cannot deliver the same
 * message twice.
 */
@Singleton
@Requires(property = "delivery.scheduler.enabled", value = "true", defaultValue = "true")
public class DlqRetryScheduler implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(DlqRetryScheduler.class);

  static final String OWNER = "dlq-retry-scheduler";

  private final DeadLetterStore store;
  private final QueuePublisher publisher;
  private final DeadLetterQueueService dlqService;
  private final DlqConfigRegistry configs;
  private final DeliveryMetrics metrics;
  private final ApplicationEventPublisher<DlqEvent> events;
  private final Clock clock;
  private final DeliveryConfig config;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public DlqRetryScheduler(
      DeadLetterStore store,
      QueuePublisher publisher,
      DeadLetterQueueService dlqService,
      DlqConfigRegistry configs,
      DeliveryMetrics metrics,
      ApplicationEventPublisher<DlqEvent> events,
      Clock clock,
      DeliveryConfig config) {
    this.store = store;
    this.publisher = publisher;
    this.dlqService = dlqService;
    this.configs = configs;
    this.metrics = metrics;
    this.events = events;
    this.clock = clock;
    this.config = config;
    start();
  }

  public void start() {
    if (running.compareAndSet(false, true)) {
      LOG.info(
          "DlqRetryScheduler started: scanInterval={} cleanupInterval={}",
          config.getScheduler().getScanInterval(),
          config.getScheduler().getCleanupInterval());
    }
  }

  public void stop() {
    if (running.compareAndSet(true, false)) {
      LOG.info("DlqRetryScheduler stopped");
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Re-delivers every due message once.
   *
   * @return number of messages pushed back to their origin queue
   */
  public int scanOnce() {
    List<RetryPointer> pointers = store.listRetryPointers();
    Instant now = clock.instant();
    int delivered = 0;
    for (RetryPointer pointer : pointers) {
      if (!pointer.isDue(now)) {
        continue;
      }
      try {
        if (redeliver(pointer)) {
          delivered++;
        }
      } catch (Exception e) {
        LOG.warn(
            "Failed to re-deliver DLQ message queue={} id={}: {}",
            pointer.queue(),
            pointer.messageId(),
            e.getMessage());
      }
    }
    if (delivered > 0) {
      LOG.info("Re-delivered {} DLQ message(s)", delivered);
    }
    return delivered;
  }

  /**
   * Best-effort audit. Store TTLs do the actual expiry; this logs the current stats and deletes
   * retry pointers whose message is gone.
   *
   * @return number of orphaned pointers removed
   */
  public int cleanupOnce() {
    int orphans = 0;
    for (RetryPointer pointer : store.listRetryPointers()) {
      try {
        if (store.get(pointer.queue(), pointer.messageId()).isEmpty()
            && store.deleteRetryPointer(pointer.queue(), pointer.messageId())) {
          orphans++;
        }
      } catch (Exception e) {
        LOG.warn(
            "Failed to audit retry pointer queue={} id={}: {}",
            pointer.queue(),
            pointer.messageId(),
            e.getMessage());
      }
    }
    DlqStats stats = dlqService.getStats(Optional.empty());
    LOG.info(
        "DLQ cleanup completed: total={} permanent={} retryScheduled={} orphanedPointersRemoved={} byQueue={}",
        stats.total(),
        stats.permanent(),
        stats.retryScheduled(),
        orphans,
        stats.byQueue());
    return orphans;
  }

  private boolean redeliver(RetryPointer pointer) {
    String queue = pointer.queue();
    String id = pointer.messageId();
    if (!store.tryClaim(queue, id, OWNER, config.getDlq().getClaimTtl())) {
      LOG.debug("Skipping claimed DLQ message queue={} id={}", queue, id);
      return false;
    }
    try {
      Optional<RetryPointer> current = store.getRetryPointer(queue, id);
      if (current.isEmpty() || current.get().retryCount() != pointer.retryCount()) {
        LOG.debug("Skipping DLQ message already handled since the scan queue={} id={}", queue, id);
        return false;
      }

      Optional<FailedMessage> found = store.get(queue, id);
      if (found.isEmpty()) {
        store.deleteRetryPointer(queue, id);
        LOG.debug("Removed orphaned retry pointer queue={} id={}", queue, id);
        return false;
      }

      FailedMessage message = found.get();
      publisher.push(queue, message.getPayload());
      message.setRetryCount(message.getRetryCount() + 1);
      message.setLastProcessedBy(OWNER);
      store.put(message, configs.resolve(queue).getRetentionPeriod());
      store.deleteRetryPointer(queue, id);

      metrics.dlqRetrySuccessful();
      LOG.debug("Re-delivered DLQ message queue={} id={} retryCount={}", queue, id, message.getRetryCount());
      publish(queue, id, message.getRetryCount());
      return true;
    } finally {
      try {
        store.releaseClaim(queue, id);
      } catch (RuntimeException e) {
        LOG.warn("Failed to release claim queue={} id={}: {}", queue, id, e.getMessage());
      }
    }
  }

  private void publish(String queue, String id, int retryCount) {
    try {
      events.publishEvent(
          new DlqEvent(
              DlqEventType.RETRY_SUCCESSFUL, queue, id, Map.of("retryCount", retryCount), clock.instant()));
    } catch (RuntimeException e) {
      LOG.warn("Failed to publish retry event for queue={} id={}: {}", queue, id, e.getMessage());
    }
  }

  @Scheduled(
      fixedDelay = "${delivery.scheduler.scan-interval:30s}",
      initialDelay = "${delivery.scheduler.scan-interval:30s}")
  public void scanTick() {
    if (!running.get()) {
      return;
    }
    try {
      scanOnce();
    } catch (Exception e) {
      LOG.error("Error in DLQ retry scan: {}", e.getMessage(), e);
    }
  }

  @Scheduled(
      fixedDelay = "${delivery.scheduler.cleanup-interval:24h}",
      initialDelay = "${delivery.scheduler.cleanup-interval:24h}")
  public void cleanupTick() {
    if (!running.get()) {
      return;
    }
    try {
      cleanupOnce();
    } catch (Exception e) {
      LOG.error("Error in DLQ cleanup: {}", e.getMessage(), e);
    }
  }

  @Override
  @PreDestroy
  public void close() {
    LOG.info("Shutting down DlqRetryScheduler");
    stop();
  }
}
