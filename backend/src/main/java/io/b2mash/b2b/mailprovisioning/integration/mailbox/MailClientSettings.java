package io.b2mash.b2b.mailprovisioning.integration.mailbox;

/** Connection details a mail client needs for IMAP or SMTP. */
public record MailClientSettings(String server, int port, Security security, String username) {

  public enum Security {
    SSL_TLS,
    STARTTLS
  }

  public static MailClientSettings imap(String server, String username) {
    return new MailClientSettings(server, 993, Security.SSL_TLS, username);
  }

  public static MailClientSettings smtp(String server, String username) {
    return new MailClientSettings(server, 587, Security.STARTTLS, username);
  }
}
