package io.b2mash.b2b.mailprovisioning.emailaccount.dto;

import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccount;
import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountStatus;
import io.b2mash.b2b.mailprovisioning.emailaccount.PurchaseType;
import java.time.Instant;
import java.util.UUID;

/**
 * Account as returned to API callers. {@code passwordToken} is only present until the password has
 * been revealed once.
 */
public record EmailAccountResponse(
    UUID id,
    String emailAddress,
    String domain,
    UUID customerId,
    UUID membershipId,
    UUID siteId,
    String provider,
    String externalId,
    String displayName,
    EmailAccountStatus status,
    int quotaMb,
    PurchaseType purchaseType,
    UUID paymentId,
    String passwordToken,
    Instant createdAt,
    Instant updatedAt) {

  public static EmailAccountResponse from(EmailAccount account) {
    return new EmailAccountResponse(
        account.getId(),
        account.getEmailAddress(),
        account.getDomain(),
        account.getCustomerId(),
        account.getMembershipId(),
        account.getSiteId(),
        account.getProvider(),
        account.getExternalId(),
        account.getDisplayName(),
        account.getStatus(),
        account.getQuotaMb(),
        account.getPurchaseType(),
        account.getPaymentId(),
        account.getPasswordDisplayToken(),
        account.getCreatedAt(),
        account.getUpdatedAt());
  }
}
