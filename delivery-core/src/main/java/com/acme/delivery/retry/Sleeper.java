package com.acme.delivery.retry;

import java.time.Duration;

/** Suspends the calling thread between attempts. Swappable so tests don't actually wait. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
