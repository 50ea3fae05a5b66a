package io.b2mash.b2b.mailprovisioning.integration.mailbox;

public record MailboxInfo(
    String emailAddress, int quotaMb, double diskUsedMb, boolean suspended, String displayName) {}
