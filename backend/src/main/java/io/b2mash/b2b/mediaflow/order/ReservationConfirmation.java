package io.b2mash.b2b.mediaflow.order;

/**
 * Outcome of confirming a reserved order number.
 *
 * @param orderNumber the number that was presented
 * @param confirmed whether the reservation is now confirmed by this call
 * @param message human-readable outcome, suitable for logs and API error details
 */
public record ReservationConfirmation(String orderNumber, boolean confirmed, String message) {

  static ReservationConfirmation confirmed(String orderNumber) {
    return new ReservationConfirmation(orderNumber, true, "Reservation confirmed");
  }

  static ReservationConfirmation rejected(String orderNumber, String message) {
    return new ReservationConfirmation(orderNumber, false, message);
  }
}
