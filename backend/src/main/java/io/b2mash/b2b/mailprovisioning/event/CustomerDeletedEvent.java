package io.b2mash.b2b.mailprovisioning.event;

import java.util.UUID;

/** Published by the host platform when a customer is removed; cascades to its email accounts. */
public record CustomerDeletedEvent(UUID customerId) {}
