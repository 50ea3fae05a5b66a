package io.b2mash.b2b.mailprovisioning.emailaccount;

public enum PurchaseType {
  /** Covered by the customer's membership; subject to its email-account limit. */
  MEMBERSHIP_INCLUDED,
  /** Bought on its own; not counted against the membership limit at admission. */
  PER_ACCOUNT_PURCHASE
}
