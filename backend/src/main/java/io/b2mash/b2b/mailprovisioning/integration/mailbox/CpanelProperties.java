package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * cPanel UAPI credentials. Either {@code password} or {@code apiToken} authenticates {@code
 * username}; the token wins when both are set.
 */
@ConfigurationProperties("mailprovisioning.providers.cpanel")
public record CpanelProperties(
    boolean enabled, String host, Integer port, String username, String password, String apiToken) {

  static final int DEFAULT_PORT = 2083;

  public CpanelProperties {
    if (port == null || port <= 0) {
      port = DEFAULT_PORT;
    }
    if (host != null) {
      host = host.trim().replaceFirst("^https?://", "").replaceAll("/+$", "");
    }
  }

  List<String> missingSettings() {
    return ProviderSettings.check()
        .require("host", host)
        .require("username", username)
        .requireEither("password", password, "api-token", apiToken)
        .missing();
  }

  boolean usesApiToken() {
    return !ProviderSettings.isBlank(apiToken);
  }
}
