package com.acme.delivery.core;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/** Generates dead letter ids of the form {@code dlq_<epochMillis>_<32 hex chars>}. */
public final class MessageIds {

  public static final String PREFIX = "dlq_";

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private MessageIds() {
    // Utility class - no instantiation
  }

  public static String next(Clock clock) {
    byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    return PREFIX + clock.millis() + "_" + HEX.formatHex(bytes);
  }
}
