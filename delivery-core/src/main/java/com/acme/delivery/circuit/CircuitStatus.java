package com.acme.delivery.circuit;

public enum CircuitStatus {
  /** Normal operation; calls pass through. */
  CLOSED,
  /** Failure threshold reached; calls are rejected until the recovery timeout elapses. */
  OPEN,
  /** Recovery timeout elapsed; trial calls are allowed. */
  HALF_OPEN
}
