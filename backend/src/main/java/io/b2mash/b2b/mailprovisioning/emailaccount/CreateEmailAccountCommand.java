package io.b2mash.b2b.mailprovisioning.emailaccount;

import java.util.UUID;

/**
 * Input to {@link EmailAccountService#createAccount}. {@code domain}, {@code quotaMb}, {@code
 * password} and {@code displayName} are optional; a password is generated when none is given.
 */
public record CreateEmailAccountCommand(
    UUID customerId,
    UUID membershipId,
    UUID siteId,
    String emailAddress,
    String domain,
    String provider,
    PurchaseType purchaseType,
    Integer quotaMb,
    String password,
    String displayName,
    UUID paymentId) {

  public CreateEmailAccountCommand {
    if (purchaseType == null) {
      purchaseType = PurchaseType.MEMBERSHIP_INCLUDED;
    }
  }

  @Override
  public String toString() {
    return "CreateEmailAccountCommand[customerId="
        + customerId
        + ", membershipId="
        + membershipId
        + ", emailAddress="
        + emailAddress
        + ", provider="
        + provider
        + ", purchaseType="
        + purchaseType
        + ", password="
        + (password == null ? "null" : "***")
        + "]";
  }
}
