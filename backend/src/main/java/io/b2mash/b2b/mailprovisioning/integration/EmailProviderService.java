package io.b2mash.b2b.mailprovisioning.integration;

import io.b2mash.b2b.mailprovisioning.exception.ResourceNotFoundException;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.DnsRecord;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.EmailProvider;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Admin-facing view of the registered mailbox providers. */
@Service
public class EmailProviderService {

  private static final Logger log = LoggerFactory.getLogger(EmailProviderService.class);

  private final EmailProviderRegistry registry;

  public EmailProviderService(EmailProviderRegistry registry) {
    this.registry = registry;
  }

  public List<ProviderSummary> listProviders(boolean usableOnly) {
    var providers =
        usableOnly
            ? registry.enabledProviders()
            : registry.availableProviders().stream().map(registry::resolve).toList();
    return providers.stream().map(ProviderSummary::from).toList();
  }

  public List<DnsRecord> dnsInstructions(String providerId, String domain) {
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("domain is required");
    }
    return require(providerId).dnsInstructions(domain.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Probes the provider with its configured credentials. An unconfigured provider answers {@code
   * NOT_CONFIGURED} without a network call.
   */
  public ConnectionTestResult testConnection(String providerId) {
    var provider = require(providerId);
    if (!provider.isUsable()) {
      return ConnectionTestResult.failed(
          providerId,
          new ProviderError(
              ProviderErrorKind.NOT_CONFIGURED,
              provider.isEnabled()
                  ? "Missing settings: " + String.join(", ", provider.missingSettings())
                  : provider.title() + " is disabled"));
    }
    var result = provider.testConnection();
    if (result.success()) {
      log.info("Connection test for {} succeeded", providerId);
    } else {
      log.warn(
          "Connection test for {} failed [{}]: {}",
          providerId,
          result.errorKind(),
          result.errorMessage());
    }
    return result;
  }

  private EmailProvider require(String providerId) {
    return registry
        .find(providerId)
        .orElseThrow(() -> ResourceNotFoundException.provider(providerId));
  }

  public record ProviderSummary(
      String id, String title, boolean enabled, boolean setup, List<String> missingSettings) {

    static ProviderSummary from(EmailProvider provider) {
      return new ProviderSummary(
          provider.providerId(),
          provider.title(),
          provider.isEnabled(),
          provider.isSetup(),
          provider.missingSettings());
    }
  }
}
