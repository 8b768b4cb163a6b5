package com.acme.delivery.retry;

import java.time.Duration;

/** The inputs {@link BackoffCalculator} needs; shared by retry policies and DLQ queue configs. */
public interface BackoffSettings {

  Duration getBaseDelay();

  Duration getMaxDelay();

  double getBackoffFactor();

  boolean isJitter();
}
