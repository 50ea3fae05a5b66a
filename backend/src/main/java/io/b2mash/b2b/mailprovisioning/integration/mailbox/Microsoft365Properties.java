package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Azure AD app registration used for Graph. {@code licenseSku} is optional. */
@ConfigurationProperties("mailprovisioning.providers.microsoft365")
public record Microsoft365Properties(
    boolean enabled, String clientId, String clientSecret, String tenantId, String licenseSku) {

  List<String> missingSettings() {
    return ProviderSettings.check()
        .require("client-id", clientId)
        .require("client-secret", clientSecret)
        .require("tenant-id", tenantId)
        .missing();
  }

  boolean assignsLicense() {
    return !ProviderSettings.isBlank(licenseSku);
  }

  @Override
  public String toString() {
    return "Microsoft365Properties[enabled="
        + enabled
        + ", clientId="
        + clientId
        + ", tenantId="
        + tenantId
        + ", licenseSku="
        + licenseSku
        + ", clientSecret=***]";
  }
}
