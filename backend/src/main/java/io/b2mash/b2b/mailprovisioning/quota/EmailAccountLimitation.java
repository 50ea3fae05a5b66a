package io.b2mash.b2b.mailprovisioning.quota;

/** A membership's email-accounts limitation entry. A disabled entry allows nothing. */
public record EmailAccountLimitation(boolean enabled, AccountLimit limit) {

  public static EmailAccountLimitation of(boolean enabled, Object rawLimit) {
    return new EmailAccountLimitation(enabled, AccountLimit.parse(rawLimit));
  }
}
