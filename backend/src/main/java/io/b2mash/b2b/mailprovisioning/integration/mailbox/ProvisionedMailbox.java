package io.b2mash.b2b.mailprovisioning.integration.mailbox;

/** What a provider reports after creating a mailbox. {@code externalId} is its own identifier. */
public record ProvisionedMailbox(String emailAddress, String externalId, int quotaMb) {}
