package com.acme.delivery.processor;

import static org.assertj.core.api.Assertions.*;

import com.acme.delivery.config.DeliveryConfig;
import com.acme.delivery.config.DlqConfig;
import com.acme.delivery.config.DlqConfigOverrides;
import com.acme.delivery.config.DlqConfigRegistry;
import com.acme.delivery.core.TransientException;
import com.acme.delivery.domain.FailedMessage;
import com.acme.delivery.domain.RetryPointer;
import com.acme.delivery.event.DlqEvent;
import com.acme.delivery.event.DlqEventType;
import com.acme.delivery.metrics.DeliveryMetrics;
import com.acme.delivery.processor.services.DeadLetterQueueServiceImpl;
import com.acme.delivery.processor.support.InMemoryDeadLetterStore;
import com.acme.delivery.processor.support.MutableClock;
import com.acme.delivery.processor.support.RecordingEventPublisher;
import com.acme.delivery.retry.BackoffCalculator;
import com.acme.delivery.spi.QueuePublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.scheduling.annotation.Scheduled;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DlqRetryScheduler Tests")
class DlqRetrySchedulerTest {

  private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
  private static final String PAYLOAD = "{\"to\":\"user@example.com\"}";

  private MutableClock clock;
  private InMemoryDeadLetterStore store;
  private List<String> pushed;
  private List<String> failingQueues;
  private RecordingEventPublisher eventPublisher;
  private SimpleMeterRegistry meterRegistry;
  private DlqConfigRegistry configs;
  private DeadLetterQueueServiceImpl service;
  private DlqRetryScheduler scheduler;
  private QueuePublisher publisher;
  private DeliveryMetrics metrics;
  private Runnable afterListing = () -> {};

  @BeforeEach
  void setup() {
    clock = new MutableClock(START);
    pushed = new CopyOnWriteArrayList<>();
    failingQueues = new CopyOnWriteArrayList<>();
    eventPublisher = new RecordingEventPublisher();
    meterRegistry = new SimpleMeterRegistry();
    configs = new DlqConfigRegistry(DlqConfig.builder().enableJitter(false).build());
    metrics = new DeliveryMetrics(meterRegistry);
    publisher =
        (queue, payload) -> {
          if (failingQueues.contains(queue)) {
            throw new TransientException("connection refused");
          }
          pushed.add(queue + "|" + payload);
        };
    wire(new InMemoryDeadLetterStore());
  }

  private void wire(InMemoryDeadLetterStore deadLetters) {
    store = deadLetters;
    DeliveryConfig config = new DeliveryConfig();
    service =
        new DeadLetterQueueServiceImpl(
            store, publisher, configs, new BackoffCalculator(), metrics, eventPublisher, clock, config);
    scheduler =
        new DlqRetryScheduler(store, publisher, service, configs, metrics, eventPublisher, clock, config);
  }

  /** Runs {@link #afterListing} after the pointer snapshot is taken, before any claim. */
  private InMemoryDeadLetterStore storeWithListingHook() {
    return new InMemoryDeadLetterStore() {
      @Override
      public List<RetryPointer> listRetryPointers() {
        List<RetryPointer> snapshot = super.listRetryPointers();
        afterListing.run();
        return snapshot;
      }
    };
  }

  @AfterEach
  void teardown() {
    scheduler.close();
  }

  private String admit(String queue, int retryCount) {
    return service.admitFailure(queue, PAYLOAD, new TransientException("SMTP timeout"), retryCount, null, null).orElseThrow();
  }

  private long eventsOf(DlqEventType type) {
    return eventPublisher.events().stream().filter(e -> e.type() == type).count();
  }

  @Nested
  @DisplayName("scanOnce")
  class ScanOnce {

    @Test
    @DisplayName("should not re-deliver before nextRetryAt")
    void testNotDue() {
      admit("emails", 0);
      clock.advance(Duration.ofMillis(999));

      assertThat(scheduler.scanOnce()).isZero();
      assertThat(pushed).isEmpty();
    }

    @Test
    @DisplayName("should re-deliver a due message exactly once and remove its pointer")
    void testDeliversOnce() {
      String id = admit("emails", 0);
      clock.advance(Duration.ofSeconds(1));

      assertThat(scheduler.scanOnce()).isEqualTo(1);
      assertThat(scheduler.scanOnce()).isZero();

      assertThat(pushed).containsExactly("emails|" + PAYLOAD);
      FailedMessage updated = store.get("emails", id).orElseThrow();
      assertThat(updated.getRetryCount()).isEqualTo(1);
      assertThat(updated.getLastProcessedBy()).isEqualTo(DlqRetryScheduler.OWNER);
      assertThat(store.pointer("emails", id)).isEmpty();
      assertThat(store.isClaimed("emails", id)).isFalse();
      assertThat(eventsOf(DlqEventType.RETRY_SUCCESSFUL)).isEqualTo(1);
      assertThat(
              meterRegistry.get(DeliveryMetrics.ERRORS).tag("error_type", "retry_successful").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep going when one message fails")
    void testFailureIsolation() {
      String broken = admit("sms", 0);
      admit("emails", 0);
      admit("emails", 0);
      failingQueues.add("sms");
      clock.advance(Duration.ofSeconds(2));

      assertThat(scheduler.scanOnce()).isEqualTo(2);

      assertThat(pushed).hasSize(2).allMatch(p -> p.startsWith("emails|"));
      assertThat(store.pointer("sms", broken)).isPresent();
      assertThat(store.isClaimed("sms", broken)).isFalse();
    }

    @Test
    @DisplayName("should skip messages claimed by a manual retry")
    void testClaimRespected() {
      String id = admit("emails", 0);
      store.tryClaim("emails", id, "manual-retry", Duration.ofSeconds(30));
      clock.advance(Duration.ofSeconds(5));

      assertThat(scheduler.scanOnce()).isZero();

      assertThat(pushed).isEmpty();
      assertThat(store.pointer("emails", id)).isPresent();
    }

    @Test
    @DisplayName("should not re-deliver a message manually retried after the pointers were listed")
    void testManualRetryBetweenListingAndClaim() {
      scheduler.close();
      wire(storeWithListingHook());
      String id = admit("emails", 0);
      afterListing = () -> assertThat(service.retryMessage("emails", id)).isTrue();
      clock.advance(Duration.ofSeconds(1));

      assertThat(scheduler.scanOnce()).isZero();

      assertThat(pushed).containsExactly("emails|" + PAYLOAD);
      assertThat(store.get("emails", id).orElseThrow().getRetryCount()).isEqualTo(1);
      assertThat(store.isClaimed("emails", id)).isFalse();
      assertThat(eventsOf(DlqEventType.RETRY_SUCCESSFUL)).isZero();
    }

    @Test
    @DisplayName("should skip a pointer rewritten with another retry count after the listing")
    void testPointerChangedSinceListing() {
      scheduler.close();
      wire(storeWithListingHook());
      String id = admit("emails", 0);
      afterListing =
          () -> store.putRetryPointer(new RetryPointer("emails", id, START.plusSeconds(60), 1), Duration.ofDays(7));
      clock.advance(Duration.ofSeconds(1));

      assertThat(scheduler.scanOnce()).isZero();

      assertThat(pushed).isEmpty();
      assertThat(store.pointer("emails", id).orElseThrow().retryCount()).isEqualTo(1);
      assertThat(store.isClaimed("emails", id)).isFalse();
    }

    @Test
    @DisplayName("should drop pointers whose message is gone")
    void testOrphanPointer() {
      store.putRetryPointer(new RetryPointer("emails", "dlq_0_gone", START, 0), Duration.ofDays(7));

      assertThat(scheduler.scanOnce()).isZero();

      assertThat(store.pointer("emails", "dlq_0_gone")).isEmpty();
      assertThat(pushed).isEmpty();
    }
  }

  @Test
  @DisplayName("emails round trip: re-delivered on schedule until permanent")
  void testEmailsRoundTrip() {
    // First failure after in-process retries
    String first = admit("emails", 0);
    assertThat(store.get("emails", first).orElseThrow().getNextRetryAt()).isEqualTo(START.plusSeconds(1));

    clock.advance(Duration.ofSeconds(1));
    assertThat(scheduler.scanOnce()).isEqualTo(1);
    assertThat(pushed).containsExactly("emails|" + PAYLOAD);
    assertThat(store.get("emails", first).orElseThrow().getRetryCount()).isEqualTo(1);
    assertThat(store.pointer("emails", first)).isEmpty();

    // The worker keeps failing; each re-admission carries the spent retry count
    for (int retryCount = 1; retryCount < 5; retryCount++) {
      String id = admit("emails", retryCount);
      Duration expected = Duration.ofSeconds(1L << retryCount);
      assertThat(store.pointer("emails", id).orElseThrow().nextRetryAt()).isEqualTo(clock.instant().plus(expected));
      clock.advance(expected);
      assertThat(scheduler.scanOnce()).isEqualTo(1);
    }
    assertThat(pushed).hasSize(5);

    String last = admit("emails", 5);
    assertThat(store.getPermanent("emails", last)).isPresent();
    assertThat(store.pointer("emails", last)).isEmpty();
    clock.advance(Duration.ofHours(2));
    assertThat(scheduler.scanOnce()).isZero();
    assertThat(eventsOf(DlqEventType.MESSAGE_PERMANENT)).isEqualTo(1);
    assertThat(eventsOf(DlqEventType.RETRY_SUCCESSFUL)).isEqualTo(5);
  }

  @Test
  @DisplayName("emails round trip with maxRetries=2: two scheduled deliveries, then permanent")
  void testEmailsRoundTripTwoRetries() {
    service.configureQueue("emails", DlqConfigOverrides.builder().maxRetries(2).build());

    String first = admit("emails", 0);
    FailedMessage active = store.get("emails", first).orElseThrow();
    assertThat(active.getRetryCount()).isZero();
    assertThat(active.getNextRetryAt()).isAfter(START);

    clock.advance(Duration.ofSeconds(1));
    assertThat(scheduler.scanOnce()).isEqualTo(1);
    assertThat(pushed).containsExactly("emails|" + PAYLOAD);
    assertThat(store.get("emails", first).orElseThrow().getRetryCount()).isEqualTo(1);

    String second = admit("emails", 1);
    assertThat(store.get("emails", second).orElseThrow().getRetryCount()).isEqualTo(1);
    assertThat(store.pointer("emails", second)).isPresent();

    String last = admit("emails", 2);
    assertThat(store.get("emails", last)).isEmpty();
    FailedMessage permanent = store.getPermanent("emails", last).orElseThrow();
    assertThat(permanent.getNextRetryAt()).isNull();
    assertThat(store.pointer("emails", last)).isEmpty();
  }

  @Nested
  @DisplayName("cleanupOnce")
  class CleanupOnce {

    @Test
    @DisplayName("should remove orphaned pointers and keep live ones")
    void testRemovesOrphans() {
      String live = admit("emails", 0);
      store.putRetryPointer(new RetryPointer("emails", "dlq_0_gone", START, 0), Duration.ofDays(7));

      assertThat(scheduler.cleanupOnce()).isEqualTo(1);

      assertThat(store.pointer("emails", live)).isPresent();
      assertThat(store.pointer("emails", "dlq_0_gone")).isEmpty();
    }

    @Test
    @DisplayName("should not touch records")
    void testKeepsRecords() {
      String id = admit("emails", 0);
      String permanent = admit("emails", 5);

      scheduler.cleanupOnce();

      assertThat(store.get("emails", id)).isPresent();
      assertThat(store.getPermanent("emails", permanent)).isPresent();
      assertThat(service.getStats(Optional.empty()).total()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("should start on construction and stop idempotently")
    void testStartStop() {
      assertThat(scheduler.isRunning()).isTrue();

      scheduler.stop();
      scheduler.stop();
      assertThat(scheduler.isRunning()).isFalse();

      scheduler.start();
      assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    @DisplayName("ticks should do nothing while stopped")
    void testTicksPausedWhileStopped() {
      admit("emails", 0);
      clock.advance(Duration.ofSeconds(1));

      scheduler.stop();
      scheduler.scanTick();
      assertThat(pushed).isEmpty();

      scheduler.start();
      scheduler.scanTick();
      assertThat(pushed).containsExactly("emails|" + PAYLOAD);
    }

    @Test
    @DisplayName("scan and cleanup ticks should be driven by @Scheduled")
    void testScheduledTicks() throws NoSuchMethodException {
      Scheduled scan = DlqRetryScheduler.class.getMethod("scanTick").getAnnotation(Scheduled.class);
      Scheduled cleanup = DlqRetryScheduler.class.getMethod("cleanupTick").getAnnotation(Scheduled.class);

      assertThat(scan.fixedDelay()).isEqualTo("${delivery.scheduler.scan-interval:30s}");
      assertThat(cleanup.fixedDelay()).isEqualTo("${delivery.scheduler.cleanup-interval:24h}");
    }

    @Test
    @DisplayName("should be annotated with @Singleton")
    void testSingleton() {
      assertThat(DlqRetryScheduler.class.isAnnotationPresent(jakarta.inject.Singleton.class)).isTrue();
    }

    @Test
    @DisplayName("close should stop the loops")
    void testClose() {
      scheduler.close();

      assertThat(scheduler.isRunning()).isFalse();
    }
  }
}
