package com.acme.delivery.circuit;

import static org.assertj.core.api.Assertions.*;

import com.acme.delivery.config.CircuitBreakerOptions;
import com.acme.delivery.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreakerRegistry Tests")
class CircuitBreakerRegistryTest {

  private static final String OP = "send_email";

  private MutableClock clock;
  private CircuitBreakerRegistry registry;

  @BeforeEach
  void setup() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    registry = new CircuitBreakerRegistry(CircuitBreakerOptions.none(), clock);
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      registry.recordFailure(OP);
    }
  }

  private CircuitStatus status() {
    return registry.snapshot(OP).orElseThrow().status();
  }

  @Nested
  @DisplayName("Tripping")
  class Tripping {

    @Test
    @DisplayName("unknown operation is closed and creates no entry")
    void testUnknown() {
      assertThat(registry.isOpen("unknown")).isFalse();
      assertThat(registry.snapshot("unknown")).isEmpty();
      assertThat(registry.operationNames()).isEmpty();
    }

    @Test
    @DisplayName("stays closed below the failure threshold")
    void testBelowThreshold() {
      fail(4);

      assertThat(registry.isOpen(OP)).isFalse();
      assertThat(status()).isEqualTo(CircuitStatus.CLOSED);
    }

    @Test
    @DisplayName("opens at the failure threshold")
    void testOpens() {
      fail(5);

      assertThat(registry.isOpen(OP)).isTrue();
      assertThat(registry.snapshot(OP).orElseThrow().failureCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("successes while closed do not reset the failure count")
    void testSuccessWhileClosed() {
      fail(3);
      registry.recordSuccess(OP);
      fail(2);

      assertThat(registry.isOpen(OP)).isTrue();
    }

    @Test
    @DisplayName("honours a configured threshold")
    void testConfiguredThreshold() {
      registry.configure(OP, CircuitBreakerOptions.builder().failureThreshold(2).build());

      fail(2);

      assertThat(registry.isOpen(OP)).isTrue();
    }

    @Test
    @DisplayName("rejects invalid options")
    void testInvalidOptions() {
      assertThatThrownBy(
              () -> registry.configure(OP, CircuitBreakerOptions.builder().failureThreshold(0).build()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Recovery")
  class Recovery {

    @BeforeEach
    void trip() {
      fail(5);
    }

    @Test
    @DisplayName("stays open until the recovery timeout elapses")
    void testStaysOpen() {
      clock.advance(Duration.ofSeconds(59));

      assertThat(registry.isOpen(OP)).isTrue();
    }

    @Test
    @DisplayName("moves to half-open once the recovery timeout elapsed")
    void testHalfOpen() {
      clock.advance(Duration.ofSeconds(60));

      assertThat(registry.isOpen(OP)).isFalse();
      assertThat(status()).isEqualTo(CircuitStatus.HALF_OPEN);
    }

    @Test
    @DisplayName("closes after three half-open successes and zeroes counters")
    void testCloses() {
      clock.advance(Duration.ofSeconds(61));
      registry.isOpen(OP);

      registry.recordSuccess(OP);
      registry.recordSuccess(OP);
      assertThat(status()).isEqualTo(CircuitStatus.HALF_OPEN);
      registry.recordSuccess(OP);

      CircuitBreakerSnapshot snapshot = registry.snapshot(OP).orElseThrow();
      assertThat(snapshot.status()).isEqualTo(CircuitStatus.CLOSED);
      assertThat(snapshot.failureCount()).isZero();
      assertThat(snapshot.successCount()).isZero();
    }

    @Test
    @DisplayName("any half-open failure re-opens the circuit")
    void testReopens() {
      clock.advance(Duration.ofSeconds(61));
      registry.isOpen(OP);
      registry.recordSuccess(OP);

      registry.recordFailure(OP);

      assertThat(status()).isEqualTo(CircuitStatus.OPEN);
      assertThat(registry.snapshot(OP).orElseThrow().successCount()).isZero();
      assertThat(registry.isOpen(OP)).isTrue();
    }

    @Test
    @DisplayName("reset forgets the breaker")
    void testReset() {
      registry.reset(OP);

      assertThat(registry.isOpen(OP)).isFalse();
      assertThat(registry.snapshot(OP)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Shared operation name")
  class Concurrency {

    private static final int THREADS = 16;
    private static final int CALLS = 250;

    private void runConcurrently(Runnable perThread) throws Exception {
      ExecutorService pool = Executors.newFixedThreadPool(THREADS);
      CountDownLatch go = new CountDownLatch(1);
      try {
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
          futures.add(
              pool.submit(
                  () -> {
                    go.await();
                    perThread.run();
                    return null;
                  }));
        }
        go.countDown();
        for (Future<?> f : futures) {
          f.get(10, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }
    }

    @Test
    @DisplayName("counts every concurrent failure and ends open")
    void testConcurrentFailures() throws Exception {
      runConcurrently(
          () -> {
            for (int i = 0; i < CALLS; i++) {
              registry.recordFailure(OP);
              registry.recordSuccess(OP);
              registry.isOpen(OP);
            }
          });

      CircuitBreakerSnapshot snapshot = registry.snapshot(OP).orElseThrow();
      assertThat(snapshot.failureCount()).isEqualTo(THREADS * CALLS);
      assertThat(snapshot.status()).isEqualTo(CircuitStatus.OPEN);
      assertThat(snapshot.successCount()).isZero();
      assertThat(registry.operationNames()).containsExactly(OP);
    }

    @Test
    @DisplayName("concurrent half-open successes close the circuit exactly once")
    void testConcurrentRecovery() throws Exception {
      fail(5);
      clock.advance(Duration.ofSeconds(61));

      runConcurrently(
          () -> {
            for (int i = 0; i < CALLS; i++) {
              assertThat(registry.isOpen(OP)).isFalse();
              registry.recordSuccess(OP);
            }
          });

      CircuitBreakerSnapshot snapshot = registry.snapshot(OP).orElseThrow();
      assertThat(snapshot.status()).isEqualTo(CircuitStatus.CLOSED);
      assertThat(snapshot.failureCount()).isZero();
      assertThat(snapshot.successCount()).isZero();
    }
  }
}
