package io.b2mash.b2b.mediaflow.order;

/** Revision allowance of an order. */
public record RevisionStatus(int maxRounds, int usedRounds, int remainingRounds) {

  public static RevisionStatus of(Order order) {
    return new RevisionStatus(
        order.getMaxRevisionRounds(),
        order.getUsedRevisionRounds(),
        Math.max(0, order.getMaxRevisionRounds() - order.getUsedRevisionRounds()));
  }
}
