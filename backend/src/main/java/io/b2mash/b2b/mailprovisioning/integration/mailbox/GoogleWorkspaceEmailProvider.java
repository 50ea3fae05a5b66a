package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.b2mash.b2b.mailprovisioning.integration.ConnectionTestResult;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
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
 * Google Workspace adapter over the Admin SDK Directory API. The service account impersonates the
 * configured super-admin: an RS256-signed JWT assertion is exchanged at Google's token endpoint
 * for a bearer token, which is cached in {@link BearerTokenCache} like Microsoft 365's.
 */
public class GoogleWorkspaceEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(GoogleWorkspaceEmailProvider.class);

  public static final String ID = "google_workspace";

  static final String TOKEN_URL = "https://oauth2.googleapis.com/token";
  static final String DIRECTORY_BASE_URL = "https://admin.googleapis.com/admin/directory/v1";
  static final String DIRECTORY_SCOPE = "https://www.googleapis.com/auth/admin.directory.user";
  static final String JWT_BEARER_GRANT = "urn:ietf:params:oauth:grant-type:jwt-bearer";
  static final Duration ASSERTION_LIFETIME = Duration.ofHours(1);
  static final String DEFAULT_FAMILY_NAME = "User";

  private final GoogleWorkspaceProperties properties;
  private final BearerTokenCache tokenCache;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final RemoteErrorTranslator errors;
  private final Clock clock;

  public GoogleWorkspaceEmailProvider(
      GoogleWorkspaceProperties properties,
      BearerTokenCache tokenCache,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this(properties, tokenCache, restClientBuilder, objectMapper, Clock.systemUTC());
  }

  GoogleWorkspaceEmailProvider(
      GoogleWorkspaceProperties properties,
      BearerTokenCache tokenCache,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.tokenCache = tokenCache;
    this.restClient = restClientBuilder.build();
    this.objectMapper = objectMapper;
    this.errors = new RemoteErrorTranslator("Google Workspace", objectMapper);
    this.clock = clock;
  }

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public String title() {
    return "Google Workspace";
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

    var name = new LinkedHashMap<String, Object>();
    name.put("givenName", request.displayNameOr(request.username()));
    name.put("familyName", DEFAULT_FAMILY_NAME);

    var user = new LinkedHashMap<String, Object>();
    user.put("primaryEmail", request.emailAddress());
    user.put("name", name);
    user.put("password", request.password());

    ProviderResult<JsonNode> created =
        directory(
            token ->
                restClient
                    .post()
                    .uri(DIRECTORY_BASE_URL + "/users")
                    .headers(h -> h.setBearerAuth(token))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(user)
                    .retrieve()
                    .body(JsonNode.class));

    return created.map(
        node -> {
          var fallback = request.emailAddress();
          var externalId = node == null ? fallback : node.path("id").asText(fallback);
          log.info("Google Workspace user created: {}", request.emailAddress());
          return new ProvisionedMailbox(request.emailAddress(), externalId, request.quotaMb());
        });
  }

  @Override
  public ProviderResult<Void> deleteEmailAccount(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (ProviderSettings.isBlank(emailAddress)) {
      return ProviderResult.failure(ProviderErrorKind.MISSING_PARAMS, "Email address is required");
    }
    return directory(
        token -> {
          restClient
              .delete()
              .uri(DIRECTORY_BASE_URL + "/users/{email}", emailAddress)
              .headers(h -> h.setBearerAuth(token))
              .retrieve()
              .toBodilessEntity();
          log.info("Google Workspace user deleted: {}", emailAddress);
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
    return directory(
        token -> {
          restClient
              .put()
              .uri(DIRECTORY_BASE_URL + "/users/{email}", emailAddress)
              .headers(h -> h.setBearerAuth(token))
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("password", newPassword))
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
        directory(
            token ->
                restClient
                    .get()
                    .uri(DIRECTORY_BASE_URL + "/users/{email}", emailAddress)
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return user.map(
        node ->
            new MailboxInfo(
                emailAddress,
                0,
                0,
                node.path("suspended").asBoolean(false),
                node.path("name").path("fullName").asText(null)));
  }

  @Override
  public String webmailUrl(MailboxAddress address) {
    return "https://mail.google.com/";
  }

  @Override
  public List<DnsRecord> dnsInstructions(String domain) {
    return List.of(
        DnsRecord.mx("@", "aspmx.l.google.com", 1, "Primary Google mail server."),
        DnsRecord.mx("@", "alt1.aspmx.l.google.com", 5, "Backup Google mail server."),
        DnsRecord.mx("@", "alt2.aspmx.l.google.com", 5, "Backup Google mail server."),
        DnsRecord.mx("@", "alt3.aspmx.l.google.com", 10, "Backup Google mail server."),
        DnsRecord.mx("@", "alt4.aspmx.l.google.com", 10, "Backup Google mail server."),
        DnsRecord.txt(
            "@",
            "v=spf1 include:_spf.google.com ~all",
            "SPF record to authorize Google to send email on your behalf."));
  }

  @Override
  public MailClientSettings imapSettings(MailboxAddress address) {
    return MailClientSettings.imap("imap.gmail.com", address.emailAddress());
  }

  @Override
  public MailClientSettings smtpSettings(MailboxAddress address) {
    return MailClientSettings.smtp("smtp.gmail.com", address.emailAddress());
  }

  @Override
  public ConnectionTestResult testConnection() {
    if (!isSetup()) {
      return ConnectionTestResult.from(ID, notConfigured());
    }
    ProviderResult<JsonNode> customer =
        directory(
            token ->
                restClient
                    .get()
                    .uri(DIRECTORY_BASE_URL + "/customers/{customerId}", properties.customerId())
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return ConnectionTestResult.from(ID, customer);
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public List<String> missingSettings() {
    return properties.missingSettings();
  }

  private <T> ProviderResult<T> directory(Function<String, T> call) {
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
    String assertion;
    try {
      var key =
          GoogleServiceAccountKey.load(Path.of(properties.serviceAccountKeyPath()), objectMapper);
      assertion = signAssertion(key);
    } catch (IOException e) {
      log.error("Cannot read Google service account key: {}", e.getMessage());
      return ProviderResult.failure(
          ProviderErrorKind.NOT_CONFIGURED, "Service account key file is unreadable");
    } catch (GeneralSecurityException | JOSEException e) {
      log.error("Cannot sign Google service account assertion: {}", e.getMessage());
      return ProviderResult.failure(
          ProviderErrorKind.INVALID_CREDENTIALS, "Service account key is invalid");
    }

    var form = new LinkedMultiValueMap<String, String>();
    form.add("grant_type", JWT_BEARER_GRANT);
    form.add("assertion", assertion);

    JsonNode body;
    try {
      body =
          restClient
              .post()
              .uri(TOKEN_URL)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      var error = errors.translate(e);
      log.error("Google token exchange failed: {}", error.message());
      return ProviderResult.failure(error);
    }

    if (body == null || body.hasNonNull("error")) {
      var message =
          body == null
              ? "Empty token response"
              : body.path("error_description").asText(body.path("error").asText());
      log.error("Google token error: {}", message);
      return ProviderResult.failure(ProviderErrorKind.INVALID_CREDENTIALS, message);
    }
    var accessToken = body.path("access_token").asText("");
    if (accessToken.isEmpty()) {
      return ProviderResult.failure(
          ProviderErrorKind.REMOTE_REJECTED, "Failed to obtain Google access token");
    }
    return ProviderResult.success(IssuedToken.of(accessToken, body.path("expires_in").asLong(0)));
  }

  /**
   * Builds the impersonation assertion: header {@code {alg:RS256,typ:JWT}}, base64url without
   * padding, RSA-SHA256 over {@code header.payload}.
   */
  String signAssertion(GoogleServiceAccountKey key) throws JOSEException {
    var now = clock.instant();
    var header = new JWSHeader.Builder(JWSAlgorithm.RS256).type(JOSEObjectType.JWT).build();
    var claims =
        new JWTClaimsSet.Builder()
            .issuer(key.clientEmail())
            .subject(properties.adminEmail())
            .audience(TOKEN_URL)
            .claim("scope", DIRECTORY_SCOPE)
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(ASSERTION_LIFETIME)))
            .build();

    var jwt = new SignedJWT(header, claims);
    jwt.sign(new RSASSASigner(key.privateKey()));
    return jwt.serialize();
  }

  private String cacheKey() {
    return ID + ":" + properties.adminEmail();
  }

  private <T> ProviderResult<T> notConfigured() {
    return ProviderResult.failure(
        ProviderErrorKind.NOT_CONFIGURED,
        "Google Workspace is missing settings: " + missingSettings());
  }
}
