package io.b2mash.b2b.mailprovisioning.event;

import java.time.Instant;
import java.util.UUID;

/**
 * The mailbox exists at the provider. Carries the plaintext password for in-process consumers such
 * as a welcome-email sender. Never persist or log it; {@link #toString()} masks it.
 */
public record EmailAccountProvisionedEvent(
    UUID accountId,
    UUID customerId,
    String emailAddress,
    String provider,
    String externalId,
    String password,
    Instant occurredAt)
    implements EmailAccountEvent {

  @Override
  public String eventType() {
    return "email_account.provisioned";
  }

  @Override
  public String toString() {
    return "EmailAccountProvisionedEvent[accountId="
        + accountId
        + ", emailAddress="
        + emailAddress
        + ", provider="
        + provider
        + ", externalId="
        + externalId
        + ", password=***]";
  }
}
