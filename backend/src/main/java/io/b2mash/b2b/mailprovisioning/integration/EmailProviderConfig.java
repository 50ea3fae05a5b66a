package io.b2mash.b2b.mailprovisioning.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.BearerTokenCache;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.CpanelEmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.CpanelProperties;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.GoogleWorkspaceEmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.GoogleWorkspaceProperties;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.Microsoft365EmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.Microsoft365Properties;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.PurelymailEmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.PurelymailProperties;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  EmailProviderConfig.HttpTimeoutProperties.class,
  CpanelProperties.class,
  PurelymailProperties.class,
  Microsoft365Properties.class,
  GoogleWorkspaceProperties.class
})
public class EmailProviderConfig {

  private static final Logger log = LoggerFactory.getLogger(EmailProviderConfig.class);

  /** Bounds every provider call and token exchange so a stuck host cannot pin a worker. */
  @ConfigurationProperties("mailprovisioning.http")
  public record HttpTimeoutProperties(Duration connectTimeout, Duration readTimeout) {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public HttpTimeoutProperties {
      if (connectTimeout == null) {
        connectTimeout = DEFAULT_TIMEOUT;
      }
      if (readTimeout == null) {
        readTimeout = DEFAULT_TIMEOUT;
      }
    }
  }

  @Bean
  RestClientCustomizer mailProviderTimeouts(HttpTimeoutProperties timeouts) {
    return builder -> {
      var httpClient = HttpClient.newBuilder().connectTimeout(timeouts.connectTimeout()).build();
      var requestFactory = new JdkClientHttpRequestFactory(httpClient);
      requestFactory.setReadTimeout(timeouts.readTimeout());
      builder.requestFactory(requestFactory);
    };
  }

  @Bean
  EmailProviderRegistry emailProviderRegistry(
      ObjectProvider<RestClient.Builder> restClientBuilders,
      ObjectMapper objectMapper,
      BearerTokenCache tokenCache,
      CpanelProperties cpanel,
      PurelymailProperties purelymail,
      Microsoft365Properties microsoft365,
      GoogleWorkspaceProperties googleWorkspace) {
    var registry = new EmailProviderRegistry();
    registry.register(
        CpanelEmailProvider.ID,
        () -> new CpanelEmailProvider(cpanel, restClientBuilders.getObject(), objectMapper));
    registry.register(
        PurelymailEmailProvider.ID,
        () ->
            new PurelymailEmailProvider(purelymail, restClientBuilders.getObject(), objectMapper));
    registry.register(
        Microsoft365EmailProvider.ID,
        () ->
            new Microsoft365EmailProvider(
                microsoft365, tokenCache, restClientBuilders.getObject(), objectMapper));
    registry.register(
        GoogleWorkspaceEmailProvider.ID,
        () ->
            new GoogleWorkspaceEmailProvider(
                googleWorkspace, tokenCache, restClientBuilders.getObject(), objectMapper));

    log.info("Registered email providers: {}", registry.availableProviders());
    return registry;
  }
}
