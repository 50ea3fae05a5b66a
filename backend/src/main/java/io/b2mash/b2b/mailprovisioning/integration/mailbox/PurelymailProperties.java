package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("mailprovisioning.providers.purelymail")
public record PurelymailProperties(boolean enabled, String apiKey) {

  List<String> missingSettings() {
    return ProviderSettings.check().require("api-key", apiKey).missing();
  }

  @Override
  public String toString() {
    return "PurelymailProperties[enabled=" + enabled + ", apiKey=***]";
  }
}
