package com.acme.delivery.processor.services;

import com.acme.delivery.config.DeliveryConfig;
import com.acme.delivery.config.DlqConfig;
import com.acme.delivery.config.DlqConfigOverrides;
import com.acme.delivery.config.DlqConfigRegistry;
import com.acme.delivery.core.MessageIds;
import com.acme.delivery.core.QueueNames;
import com.acme.delivery.domain.DlqStats;
import com.acme.delivery.domain.FailedMessage;
import com.acme.delivery.domain.QueueStats;
import com.acme.delivery.domain.RetryPointer;
import com.acme.delivery.event.DlqEvent;
import com.acme.delivery.event.DlqEventType;
import com.acme.delivery.metrics.DeliveryMetrics;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.repository.DlqKeys;
import com.acme.delivery.retry.BackoffCalculator;
import com.acme.delivery.service.DeadLetterQueueService;
import com.acme.delivery.spi.QueuePublisher;
import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DeadLetterQueueServiceImpl implements DeadLetterQueueService {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterQueueServiceImpl.class);

  static final String MANUAL_RETRY = "manual-retry";

  private final DeadLetterStore store;
  private final QueuePublisher publisher;
  private final DlqConfigRegistry configs;
  private final BackoffCalculator backoff;
  private final DeliveryMetrics metrics;
  private final ApplicationEventPublisher<DlqEvent> events;
  private final Clock clock;
  private final Duration claimTtl;

  // Queues whose threshold alert has fired and not yet re-armed
  private final Set<String> alerted = ConcurrentHashMap.newKeySet();

  public DeadLetterQueueServiceImpl(
      DeadLetterStore store,
      QueuePublisher publisher,
      DlqConfigRegistry configs,
      BackoffCalculator backoff,
      DeliveryMetrics metrics,
      ApplicationEventPublisher<DlqEvent> events,
      Clock clock,
      DeliveryConfig deliveryConfig) {
    this.store = store;
    this.publisher = publisher;
    this.configs = configs;
    this.backoff = backoff;
    this.metrics = metrics;
    this.events = events;
    this.clock = clock;
    this.claimTtl = deliveryConfig.getDlq().getClaimTtl();
  }

  @Override
  public Optional<String> admitFailure(
      String queue,
      String payload,
      Throwable error,
      int currentRetryCount,
      DlqConfigOverrides overrides,
      Map<String, String> metadata) {
    DlqConfig config;
    try {
      QueueNames.requireValid(queue);
      config = configs.resolve(queue, overrides);
    } catch (RuntimeException e) {
      LOG.error("Rejected DLQ admission for queue={}: {}", queue, e.getMessage());
      return Optional.empty();
    }

    Instant now = clock.instant();
    FailedMessage message = new FailedMessage();
    message.setId(MessageIds.next(clock));
    message.setQueue(queue);
    message.setPayload(payload);
    message.setError(describe(error));
    message.setStackTrace(stackTrace(error));
    message.setRetryCount(currentRetryCount);
    message.setMaxRetries(config.getMaxRetries());
    message.setFailedAt(now);
    message.setMetadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata));

    LOG.warn(
        "Message added to DLQ: queue={} id={} retryCount={} maxRetries={} error={}",
        queue,
        message.getId(),
        currentRetryCount,
        config.getMaxRetries(),
        message.getError());

    boolean permanent = message.isRetryBudgetExhausted();
    try {
      if (permanent) {
        store.movePermanent(message, config.getRetentionPeriod());
      } else {
        message.setNextRetryAt(now.plus(backoff.delay(currentRetryCount + 1, config)));
        store.putRetryPointer(RetryPointer.of(message), config.getRetentionPeriod());
        store.put(message, config.getRetentionPeriod());
        LOG.debug("Scheduled retry for queue={} id={} at {}", queue, message.getId(), message.getNextRetryAt());
      }
    } catch (RuntimeException e) {
      metrics.dlqStoreFailure();
      LOG.error(
          "Failed to store DLQ message queue={} original error={}: {}",
          queue,
          message.getError(),
          e.getMessage(),
          e);
      return Optional.empty();
    }

    if (permanent) {
      metrics.dlqPermanent();
      LOG.error(
          "Message moved to permanent DLQ: queue={} id={} finalRetryCount={}",
          queue,
          message.getId(),
          message.getRetryCount());
      emit(
          DlqEventType.MESSAGE_PERMANENT,
          queue,
          message.getId(),
          Map.of("finalRetryCount", message.getRetryCount(), "error", message.getError()));
      checkAlertThreshold(queue, config);
    }

    metrics.dlqMessage();
    emit(
        DlqEventType.MESSAGE_ADDED,
        queue,
        message.getId(),
        Map.of("error", message.getError(), "retryCount", currentRetryCount));
    return Optional.of(message.getId());
  }

  @Override
  public boolean retryMessage(String queue, String id) {
    try {
      if (!store.tryClaim(queue, id, MANUAL_RETRY, claimTtl)) {
        LOG.info("Message queue={} id={} is already being re-delivered", queue, id);
        return false;
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to claim DLQ message queue={} id={}: {}", queue, id, e.getMessage());
      return false;
    }

    try {
      boolean permanent = false;
      Optional<FailedMessage> found = store.get(queue, id);
      if (found.isEmpty()) {
        found = store.getPermanent(queue, id);
        permanent = found.isPresent();
      }
      if (found.isEmpty()) {
        LOG.warn("Manual retry requested for unknown message queue={} id={}", queue, id);
        return false;
      }

      FailedMessage message = found.get();
      publisher.push(queue, message.getPayload());
      message.setRetryCount(message.getRetryCount() + 1);
      message.setLastProcessedBy(MANUAL_RETRY);

      Duration retention = configs.resolve(queue).getRetentionPeriod();
      if (permanent) {
        store.putPermanent(message, retention);
      } else {
        store.put(message, retention);
        store.deleteRetryPointer(queue, id);
      }

      LOG.info(
          "Manually retried message queue={} id={} newRetryCount={} permanent={}",
          queue,
          id,
          message.getRetryCount(),
          permanent);
      emit(
          DlqEventType.MANUAL_RETRY,
          queue,
          id,
          Map.of("newRetryCount", message.getRetryCount(), "permanent", permanent));
      return true;
    } catch (RuntimeException e) {
      metrics.dlqStoreFailure();
      LOG.error("Manual retry failed for queue={} id={}: {}", queue, id, e.getMessage(), e);
      return false;
    } finally {
      release(queue, id);
    }
  }

  @Override
  public boolean deleteMessage(String queue, String id) {
    try {
      boolean active = store.delete(queue, id);
      boolean permanent = store.deletePermanent(queue, id);
      boolean pointer = store.deleteRetryPointer(queue, id);
      if (!(active || permanent || pointer)) {
        return false;
      }
      LOG.info("Deleted DLQ message queue={} id={}", queue, id);
      emit(DlqEventType.MESSAGE_DELETED, queue, id, Map.of());
      if (permanent) {
        checkAlertThreshold(queue, configs.resolve(queue));
      }
      return true;
    } catch (RuntimeException e) {
      LOG.error("Failed to delete DLQ message queue={} id={}: {}", queue, id, e.getMessage(), e);
      return false;
    }
  }

  @Override
  public DlqStats getStats(Optional<String> queue) {
    try {
      long total = 0;
      long permanent = 0;
      long retryScheduled = 0;
      Map<String, QueueStats> byQueue = new TreeMap<>();
      for (String key : store.listByPrefix(DlqKeys.ALL_PATTERN)) {
        Optional<DlqKeys.Key> parsed = DlqKeys.parse(key);
        if (parsed.isEmpty() || queue.map(q -> !q.equals(parsed.get().queue())).orElse(false)) {
          continue;
        }
        DlqKeys.Key k = parsed.get();
        QueueStats current = byQueue.getOrDefault(k.queue(), QueueStats.EMPTY);
        switch (k.kind()) {
          case ACTIVE -> {
            total++;
            byQueue.put(k.queue(), current.plusTotal());
          }
          case PERMANENT -> {
            permanent++;
            byQueue.put(k.queue(), current.plusPermanent());
          }
          case RETRY_POINTER -> {
            retryScheduled++;
            byQueue.put(k.queue(), current.plusRetry());
          }
          case CLAIM -> {
            // transient lock, not a message
          }
        }
      }
      return new DlqStats(total, permanent, retryScheduled, Map.copyOf(byQueue));
    } catch (RuntimeException e) {
      LOG.error("Failed to compute DLQ stats: {}", e.getMessage(), e);
      return DlqStats.empty();
    }
  }

  @Override
  public DlqConfig configureQueue(String queue, DlqConfigOverrides overrides) {
    QueueNames.requireValid(queue);
    DlqConfig config = configs.configure(queue, overrides);
    LOG.info("Configured DLQ for queue={}: {}", queue, config);
    return config;
  }

  /**
   * Fires {@link DlqEventType#THRESHOLD_EXCEEDED} once when the queue's permanent count reaches
   * the threshold. The alert re-arms after a check sees the count drop below it again.
   */
  void checkAlertThreshold(String queue, DlqConfig config) {
    try {
      long count = store.countPermanent(queue);
      if (count < config.getAlertThreshold()) {
        if (alerted.remove(queue)) {
          LOG.info("Permanent DLQ count for queue={} back below threshold ({} < {})", queue, count, config.getAlertThreshold());
        }
        return;
      }
      if (alerted.add(queue)) {
        LOG.error(
            "DLQ alert threshold exceeded for queue={}: count={} threshold={}",
            queue,
            count,
            config.getAlertThreshold());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("count", count);
        attributes.put("threshold", config.getAlertThreshold());
        emit(DlqEventType.THRESHOLD_EXCEEDED, queue, null, attributes);
      }
    } catch (RuntimeException e) {
      LOG.warn("Failed to check DLQ alert threshold for queue={}: {}", queue, e.getMessage());
    }
  }

  private void emit(DlqEventType type, String queue, String id, Map<String, Object> attributes) {
    try {
      events.publishEvent(new DlqEvent(type, queue, id, attributes, clock.instant()));
    } catch (RuntimeException e) {
      LOG.warn("Failed to publish {} for queue={} id={}: {}", type.getEventName(), queue, id, e.getMessage());
    }
  }

  private void release(String queue, String id) {
    try {
      store.releaseClaim(queue, id);
    } catch (RuntimeException e) {
      LOG.warn("Failed to release claim queue={} id={}, it expires in {}: {}", queue, id, claimTtl, e.getMessage());
    }
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
  }

  private static String stackTrace(Throwable error) {
    if (error == null) {
      return null;
    }
    StringWriter out = new StringWriter();
    error.printStackTrace(new PrintWriter(out));
    return out.toString();
  }
}
