package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import io.b2mash.b2b.mailprovisioning.integration.ConnectionTestResult;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.util.List;

/**
 * Port for managing mailboxes at an external mail host (cPanel, Purelymail, Microsoft 365, Google
 * Workspace). Implementations hold no per-account state; short-lived auth tokens live in the shared
 * {@link BearerTokenCache}.
 *
 * <p>Mutating operations must not be called unless the provider is both {@link #isEnabled()
 * enabled} and {@link #isSetup() set up}; if they are, they answer {@code NOT_CONFIGURED}.
 */
public interface EmailProvider {

  /** Registry key (e.g., "cpanel", "purelymail"). */
  String providerId();

  /** Human-readable name for admin screens. */
  String title();

  ProviderResult<ProvisionedMailbox> createEmailAccount(CreateMailboxRequest request);

  ProviderResult<Void> deleteEmailAccount(String emailAddress);

  ProviderResult<Void> changePassword(String emailAddress, String newPassword);

  ProviderResult<MailboxInfo> getAccountInfo(String emailAddress);

  String webmailUrl(MailboxAddress address);

  /** DNS records the customer must publish, in the order they should be shown. */
  List<DnsRecord> dnsInstructions(String domain);

  MailClientSettings imapSettings(MailboxAddress address);

  MailClientSettings smtpSettings(MailboxAddress address);

  /** Test connectivity with the configured credentials. */
  ConnectionTestResult testConnection();

  boolean isEnabled();

  /** Names of required settings that are unset or blank. Empty when the provider is usable. */
  List<String> missingSettings();

  default boolean isSetup() {
    return missingSettings().isEmpty();
  }

  default boolean isUsable() {
    return isEnabled() && isSetup();
  }
}
