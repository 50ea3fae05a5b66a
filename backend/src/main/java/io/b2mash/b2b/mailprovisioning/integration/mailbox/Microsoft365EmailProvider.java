package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.ConnectionTestResult;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Microsoft 365 adapter over Microsoft Graph. Authenticates with the OAuth2 client-credentials
 * grant; the bearer token is cached in {@link BearerTokenCache} per tenant and evicted when Graph
 * answers 401.
 *
 * <p>When a license SKU is configured it is assigned in a second call after the user is created.
 * A failed assignment is logged and does not fail creation: the mailbox exists but is unlicensed.
 */
public class Microsoft365EmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(Microsoft365EmailProvider.class);

  public static final String ID = "microsoft365";

  static final String TOKEN_URL = "https://login.microsoftonline.com/{tenant}/oauth2/v2.0/token";
  static final String GRAPH_SCOPE = "https://graph.microsoft.com/.default";
  static final String GRAPH_BASE_URL = "https://graph.microsoft.com/v1.0";
  static final String DEFAULT_SURNAME = "User";
  static final String USAGE_LOCATION = "US";

  private final Microsoft365Properties properties;
  private final BearerTokenCache tokenCache;
  private final RestClient restClient;
  private final RemoteErrorTranslator errors;

  public Microsoft365EmailProvider(
      Microsoft365Properties properties,
      BearerTokenCache tokenCache,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.tokenCache = tokenCache;
    this.restClient = restClientBuilder.build();
    this.errors = new RemoteErrorTranslator("Microsoft 365", objectMapper);
  }

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public String title() {
    return "Microsoft 365";
  }

  @Override
  public ProviderResult<ProvisionedMailbox> createEmailAccount(CreateMailboxRequest request) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (!request.missingParams().isEmpty()) {
      return ProviderResult.failure(
          ProviderErrorKind.MISSING_PARAMS, "Missing parameters: " + request.missingParams());
    }

    var passwordProfile = new LinkedHashMap<String, Object>();
    passwordProfile.put("forceChangePasswordNextSignIn", false);
    passwordProfile.put("password", request.password());

    var user = new LinkedHashMap<String, Object>();
    user.put("accountEnabled", true);
    user.put("displayName", request.displayNameOr(request.username()));
    user.put("mailNickname", request.username());
    user.put("userPrincipalName", request.emailAddress());
    user.put("givenName", request.username());
    user.put("surname", DEFAULT_SURNAME);
    user.put("passwordProfile", passwordProfile);
    // Graph refuses license assignment without a usage location
    user.put("usageLocation", USAGE_LOCATION);

    ProviderResult<JsonNode> created =
        graph(
            token ->
                restClient
                    .post()
                    .uri(GRAPH_BASE_URL + "/users")
                    .headers(h -> h.setBearerAuth(token))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(user)
                    .retrieve()
                    .body(JsonNode.class));
    if (!created.isSuccess()) {
      return ProviderResult.failure(created.error());
    }

    var userId = created.value() == null ? "" : created.value().path("id").asText("");
    if (properties.assignsLicense() && !userId.isEmpty()) {
      assignLicense(userId, request.emailAddress());
    }

    log.info("Microsoft 365 user created: {}", request.emailAddress());
    return ProviderResult.success(
        new ProvisionedMailbox(request.emailAddress(), userId, request.quotaMb()));
  }

  private void assignLicense(String userId, String emailAddress) {
    var license = new LinkedHashMap<String, Object>();
    license.put("addLicenses", List.of(Map.of("skuId", properties.licenseSku())));
    license.put("removeLicenses", List.of());

    ProviderResult<Void> result =
        graph(
            token -> {
              restClient
                  .post()
                  .uri(GRAPH_BASE_URL + "/users/{id}/assignLicense", userId)
                  .headers(h -> h.setBearerAuth(token))
                  .contentType(MediaType.APPLICATION_JSON)
                  .body(license)
                  .retrieve()
                  .toBodilessEntity();
              return null;
            });
    if (!result.isSuccess()) {
      log.warn(
          "License assignment failed for {}, mailbox left unlicensed: {}",
          emailAddress,
          result.error().message());
    }
  }

  @Override
  public ProviderResult<Void> deleteEmailAccount(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (ProviderSettings.isBlank(emailAddress)) {
      return ProviderResult.failure(ProviderErrorKind.MISSING_PARAMS, "Email address is required");
    }
    return graph(
        token -> {
          restClient
              .delete()
              .uri(GRAPH_BASE_URL + "/users/{upn}", emailAddress)
              .headers(h -> h.setBearerAuth(token))
              .retrieve()
              .toBodilessEntity();
          log.info("Microsoft 365 user deleted: {}", emailAddress);
          return null;
        });
  }

  @Override
  public ProviderResult<Void> changePassword(String emailAddress, String newPassword) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (ProviderSettings.isBlank(emailAddress) || ProviderSettings.isBlank(newPassword)) {
      return ProviderResult.failure(
          ProviderErrorKind.MISSING_PARAMS, "Email address and new password are required");
    }
    var passwordProfile = new LinkedHashMap<String, Object>();
    passwordProfile.put("forceChangePasswordNextSignIn", false);
    passwordProfile.put("password", newPassword);

    return graph(
        token -> {
          restClient
              .patch()
              .uri(GRAPH_BASE_URL + "/users/{upn}", emailAddress)
              .headers(h -> h.setBearerAuth(token))
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("passwordProfile", passwordProfile))
              .retrieve()
              .toBodilessEntity();
          return null;
        });
  }

  @Override
  public ProviderResult<MailboxInfo> getAccountInfo(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (ProviderSettings.isBlank(emailAddress)) {
      return ProviderResult.failure(ProviderErrorKind.MISSING_PARAMS, "Email address is required");
    }
    ProviderResult<JsonNode> user =
        graph(
            token ->
                restClient
                    .get()
                    .uri(GRAPH_BASE_URL + "/users/{upn}", emailAddress)
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return user.map(
        node ->
            new MailboxInfo(
                emailAddress,
                0,
                0,
                !node.path("accountEnabled").asBoolean(true),
                node.path("displayName").asText(null)));
  }

  @Override
  public String webmailUrl(MailboxAddress address) {
    return "https://outlook.office365.com/";
  }

  @Override
  public List<DnsRecord> dnsInstructions(String domain) {
    var dkimDomain = domain.replace('.', '-');
    return List.of(
        DnsRecord.mx(
            "@",
            domain + ".mail.protection.outlook.com",
            0,
            "Mail exchanger record for Microsoft 365."),
        DnsRecord.txt(
            "@",
            "v=spf1 include:spf.protection.outlook.com -all",
            "SPF record to authorize Microsoft 365 to send email."),
        DnsRecord.cname(
            "autodiscover",
            "autodiscover.outlook.com",
            "Autodiscover record for Outlook client configuration."),
        DnsRecord.cname(
            "selector1._domainkey",
            "selector1-" + dkimDomain + "._domainkey.YOUR_TENANT.onmicrosoft.com",
            "DKIM selector 1. Replace YOUR_TENANT with your tenant name."),
        DnsRecord.cname(
            "selector2._domainkey",
            "selector2-" + dkimDomain + "._domainkey.YOUR_TENANT.onmicrosoft.com",
            "DKIM selector 2. Replace YOUR_TENANT with your tenant name."));
  }

  @Override
  public MailClientSettings imapSettings(MailboxAddress address) {
    return MailClientSettings.imap("outlook.office365.com", address.emailAddress());
  }

  @Override
  public MailClientSettings smtpSettings(MailboxAddress address) {
    return MailClientSettings.smtp("smtp.office365.com", address.emailAddress());
  }

  @Override
  public ConnectionTestResult testConnection() {
    if (!isSetup()) {
      return ConnectionTestResult.from(ID, notConfigured());
    }
    ProviderResult<JsonNode> organization =
        graph(
            token ->
                restClient
                    .get()
                    .uri(GRAPH_BASE_URL + "/organization")
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return ConnectionTestResult.from(ID, organization);
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public List<String> missingSettings() {
    return properties.missingSettings();
  }

  /** Runs a Graph call with a cached bearer token, translating HTTP failures. */
  private <T> ProviderResult<T> graph(Function<String, T> call) {
    var token = tokenCache.getOrFetch(cacheKey(), this::requestToken);
    if (!token.isSuccess()) {
      return ProviderResult.failure(token.error());
    }
    try {
      return ProviderResult.success(call.apply(token.value()));
    } catch (HttpClientErrorException.Unauthorized e) {
      tokenCache.evict(cacheKey());
      return ProviderResult.failure(errors.translate(e));
    } catch (RestClientException e) {
      return ProviderResult.failure(errors.translate(e));
    }
  }

  ProviderResult<IssuedToken> requestToken() {
    var form = new LinkedMultiValueMap<String, String>();
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    form.add("scope", GRAPH_SCOPE);
    form.add("grant_type", "client_credentials");

    JsonNode body;
    try {
      body =
          restClient
              .post()
              .uri(TOKEN_URL, properties.tenantId())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      var error = errors.translate(e);
      log.error("Microsoft 365 token request failed: {}", error.message());
      return ProviderResult.failure(error);
    }

    if (body == null || body.hasNonNull("error")) {
      var message =
          body == null
              ? "Empty token response"
              : body.path("error_description").asText(body.path("error").asText());
      log.error("Microsoft 365 token error: {}", message);
      return ProviderResult.failure(ProviderErrorKind.INVALID_CREDENTIALS, message);
    }
    var accessToken = body.path("access_token").asText("");
    if (accessToken.isEmpty()) {
      return ProviderResult.failure(
          ProviderErrorKind.REMOTE_REJECTED, "Failed to obtain Microsoft 365 access token");
    }
    return ProviderResult.success(IssuedToken.of(accessToken, body.path("expires_in").asLong(0)));
  }

  private String cacheKey() {
    return ID + ":" + properties.tenantId();
  }

  private <T> ProviderResult<T> notConfigured() {
    return ProviderResult.failure(
        ProviderErrorKind.NOT_CONFIGURED,
        "Microsoft 365 is missing settings: " + missingSettings());
  }
}
