package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.integration.mailbox.MailClientSettings;

/** Everything a customer needs to reach their mailbox. */
public record MailClientConfiguration(
    String webmailUrl, MailClientSettings imap, MailClientSettings smtp) {}
