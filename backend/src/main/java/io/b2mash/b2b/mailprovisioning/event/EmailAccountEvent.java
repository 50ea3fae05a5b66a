package io.b2mash.b2b.mailprovisioning.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle events for email accounts, published via Spring's ApplicationEventPublisher. All
 * implementations are records of ids and strings only, never JPA entities, so they stay valid after
 * the publishing transaction commits.
 */
public sealed interface EmailAccountEvent
    permits EmailAccountCreatedEvent,
        EmailAccountProvisionedEvent,
        EmailAccountProvisioningFailedEvent,
        EmailAccountSuspendedEvent,
        EmailAccountReactivatedEvent,
        EmailAccountDeletedEvent {

  /** Dotted event name, e.g. {@code email_account.provisioned}. */
  String eventType();

  UUID accountId();

  UUID customerId();

  String emailAddress();

  String provider();

  Instant occurredAt();
}
