package com.acme.delivery.repository;

import com.acme.delivery.core.QueueNames;
import java.util.Optional;

/**
 * Key scheme for dead letter records:
 *
 * <pre>
 *   dlq:{queue}:{id}             active record
 *   dlq:{queue}:retry:{id}       retry pointer
 *   dlq:permanent:{queue}:{id}   permanent record
 *   dlq:claim:{queue}:{id}       re-delivery claim
 * </pre>
 *
 * Queue names are validated by {@link QueueNames} so the layouts never collide.
 */
public final class DlqKeys {

  public static final String ROOT = "dlq";
  public static final String PERMANENT = "permanent";
  public static final String RETRY = "retry";
  public static final String CLAIM = "claim";

  public static final String ALL_PATTERN = ROOT + ":*";
  public static final String RETRY_POINTER_PATTERN = ROOT + ":*:" + RETRY + ":*";

  public enum Kind {
    ACTIVE,
    RETRY_POINTER,
    PERMANENT,
    CLAIM
  }

  /** A parsed key. */
  public record Key(Kind kind, String queue, String id) {}

  private DlqKeys() {
    // Utility class - no instantiation
  }

  public static String active(String queue, String id) {
    return ROOT + ":" + QueueNames.requireValid(queue) + ":" + id;
  }

  public static String retryPointer(String queue, String id) {
    return ROOT + ":" + QueueNames.requireValid(queue) + ":" + RETRY + ":" + id;
  }

  public static String permanent(String queue, String id) {
    return ROOT + ":" + PERMANENT + ":" + QueueNames.requireValid(queue) + ":" + id;
  }

  public static String claim(String queue, String id) {
    return ROOT + ":" + CLAIM + ":" + QueueNames.requireValid(queue) + ":" + id;
  }

  public static String permanentPattern(String queue) {
    return ROOT + ":" + PERMANENT + ":" + QueueNames.requireValid(queue) + ":*";
  }

  /** Parses a key produced by this class; anything else is empty. */
  public static Optional<Key> parse(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String[] parts = key.split(":", -1);
    if (parts.length < 3 || !ROOT.equals(parts[0])) {
      return Optional.empty();
    }
    if (parts.length == 3) {
      return Optional.of(new Key(Kind.ACTIVE, parts[1], parts[2]));
    }
    if (parts.length != 4) {
      return Optional.empty();
    }
    if (PERMANENT.equals(parts[1])) {
      return Optional.of(new Key(Kind.PERMANENT, parts[2], parts[3]));
    }
    if (CLAIM.equals(parts[1])) {
      return Optional.of(new Key(Kind.CLAIM, parts[2], parts[3]));
    }
    if (RETRY.equals(parts[2])) {
      return Optional.of(new Key(Kind.RETRY_POINTER, parts[1], parts[3]));
    }
    return Optional.empty();
  }
}
