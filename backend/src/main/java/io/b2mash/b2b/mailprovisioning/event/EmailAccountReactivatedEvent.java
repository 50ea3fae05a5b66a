package io.b2mash.b2b.mailprovisioning.event;

import java.time.Instant;
import java.util.UUID;

public record EmailAccountReactivatedEvent(
    UUID accountId, UUID customerId, String emailAddress, String provider, Instant occurredAt)
    implements EmailAccountEvent {

  @Override
  public String eventType() {
    return "email_account.reactivated";
  }
}
