package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service account with domain-wide delegation. {@code adminEmail} is the super-admin the service
 * account impersonates; {@code customerId} is the Workspace customer (or {@code my_customer}).
 */
@ConfigurationProperties("mailprovisioning.providers.google-workspace")
public record GoogleWorkspaceProperties(
    boolean enabled, String serviceAccountKeyPath, String adminEmail, String customerId) {

  List<String> missingSettings() {
    return ProviderSettings.check()
        .require("service-account-key-path", serviceAccountKeyPath)
        .require("admin-email", adminEmail)
        .require("customer-id", customerId)
        .missing();
  }
}
