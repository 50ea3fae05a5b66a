package io.b2mash.b2b.mailprovisioning.event;

import java.time.Instant;
import java.util.UUID;

/** {@code errorKind} is the normalized provider error code, e.g. {@code remote_rejected}. */
public record EmailAccountProvisioningFailedEvent(
    UUID accountId,
    UUID customerId,
    String emailAddress,
    String provider,
    String errorKind,
    String errorMessage,
    Instant occurredAt)
    implements EmailAccountEvent {

  @Override
  public String eventType() {
    return "email_account.provisioning_failed";
  }
}
