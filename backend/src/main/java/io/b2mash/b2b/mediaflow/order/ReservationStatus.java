package io.b2mash.b2b.mediaflow.order;

import java.util.Locale;

/** Lifecycle of an order-number reservation. Only RESERVED has outgoing edges. */
public enum ReservationStatus {
  RESERVED,
  CONFIRMED,
  EXPIRED;

  public boolean canTransitionTo(ReservationStatus target) {
    return this == RESERVED && (target == CONFIRMED || target == EXPIRED);
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
