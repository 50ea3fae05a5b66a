package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.ConnectionTestResult;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Purelymail adapter. Every request is a JSON POST carrying the static {@code Purelymail-Api-Key}
 * header; responses are {@code {success, message, result}}. Purelymail identifies users by their
 * full email address and manages storage per account, so quota is always reported as 0.
 */
public class PurelymailEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(PurelymailEmailProvider.class);

  public static final String ID = "purelymail";

  static final String API_BASE_URL = "https://purelymail.com/api/v0";
  static final String API_KEY_HEADER = "Purelymail-Api-Key";

  private final PurelymailProperties properties;
  private final RestClient restClient;
  private final RemoteErrorTranslator errors;

  public PurelymailEmailProvider(
      PurelymailProperties properties,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.restClient = restClientBuilder.build();
    this.errors = new RemoteErrorTranslator("Purelymail", objectMapper);
  }

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public String title() {
    return "Purelymail";
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

    ensureDomain(request.domain());

    var body = new LinkedHashMap<String, Object>();
    body.put("userName", request.emailAddress());
    body.put("password", request.password());
    body.put("enablePasswordReset", false);

    return call("createUser", body)
        .map(
            result -> {
              log.info("Purelymail mailbox created: {}", request.emailAddress());
              return new ProvisionedMailbox(request.emailAddress(), request.emailAddress(), 0);
            });
  }

  /**
   * Purelymail has no non-error "does this domain exist" call, so the domain is added
   * unconditionally and "already" answers count as success. Any other failure is left for
   * createUser to report.
   */
  private void ensureDomain(String domain) {
    var result = call("addDomainName", Map.of("domainName", domain));
    if (result.isSuccess()) {
      log.info("Purelymail domain added: {}", domain);
      return;
    }
    var message = result.error().message();
    if (message != null && message.toLowerCase(Locale.ROOT).contains("already")) {
      log.debug("Purelymail domain {} already present", domain);
    } else {
      log.warn("Purelymail could not add domain {}: {}", domain, message);
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
    return call("deleteUser", Map.of("userName", emailAddress))
        .map(
            result -> {
              log.info("Purelymail mailbox deleted: {}", emailAddress);
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
    return call("modifyUser", Map.of("userName", emailAddress, "password", newPassword))
        .map(result -> null);
  }

  @Override
  public ProviderResult<MailboxInfo> getAccountInfo(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    if (ProviderSettings.isBlank(emailAddress)) {
      return ProviderResult.failure(ProviderErrorKind.MISSING_PARAMS, "Email address is required");
    }
    return call("getUser", Map.of("userName", emailAddress))
        .map(result -> new MailboxInfo(emailAddress, 0, 0, false, null));
  }

  @Override
  public String webmailUrl(MailboxAddress address) {
    return "https://app.purelymail.com/";
  }

  @Override
  public List<DnsRecord> dnsInstructions(String domain) {
    return List.of(
        DnsRecord.mx(
            "@", "mailserver.purelymail.com", 10, "Mail exchanger record for receiving email."),
        DnsRecord.txt(
            "@",
            "v=spf1 include:_spf.purelymail.com ~all",
            "SPF record to authorize Purelymail to send email on your behalf."),
        DnsRecord.cname(
            "purelymail._domainkey",
            "key1._domainkey.purelymail.com",
            "DKIM record for email authentication."),
        DnsRecord.txt(
            "_dmarc",
            "v=DMARC1; p=quarantine; rua=mailto:dmarc@" + domain,
            "DMARC policy for handling unauthenticated email."));
  }

  @Override
  public MailClientSettings imapSettings(MailboxAddress address) {
    return MailClientSettings.imap("imap.purelymail.com", address.emailAddress());
  }

  @Override
  public MailClientSettings smtpSettings(MailboxAddress address) {
    return MailClientSettings.smtp("smtp.purelymail.com", address.emailAddress());
  }

  @Override
  public ConnectionTestResult testConnection() {
    if (!isSetup()) {
      return ConnectionTestResult.from(ID, notConfigured());
    }
    return ConnectionTestResult.from(ID, call("listDomainNames", Map.of()));
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public List<String> missingSettings() {
    return properties.missingSettings();
  }

  private ProviderResult<JsonNode> call(String endpoint, Map<String, ?> payload) {
    JsonNode body;
    try {
      body =
          restClient
              .post()
              .uri(API_BASE_URL + "/" + endpoint)
              .header(API_KEY_HEADER, properties.apiKey())
              .contentType(MediaType.APPLICATION_JSON)
              .body(payload)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      var error = errors.translate(e);
      log.error("Purelymail {} failed: {}", endpoint, error.message());
      return ProviderResult.failure(error);
    }

    if (body == null) {
      return ProviderResult.failure(
          ProviderErrorKind.REMOTE_REJECTED, "Empty response from Purelymail " + endpoint);
    }
    if (isError(body)) {
      var message = body.path("message").asText("Unknown Purelymail API error");
      return ProviderResult.failure(kindFor(message), message);
    }
    return ProviderResult.success(body.path("result"));
  }

  private static boolean isError(JsonNode body) {
    if (body.has("success")) {
      return !body.path("success").asBoolean(false);
    }
    return "error".equals(body.path("type").asText());
  }

  static ProviderErrorKind kindFor(String message) {
    var lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("already")) {
      return ProviderErrorKind.ALREADY_EXISTS;
    }
    if (lower.contains("not found") || lower.contains("does not exist")) {
      return ProviderErrorKind.NOT_FOUND;
    }
    if (lower.contains("api key") || lower.contains("unauthorized")) {
      return ProviderErrorKind.INVALID_CREDENTIALS;
    }
    return ProviderErrorKind.REMOTE_REJECTED;
  }

  private <T> ProviderResult<T> notConfigured() {
    return ProviderResult.failure(
        ProviderErrorKind.NOT_CONFIGURED, "Purelymail is missing settings: " + missingSettings());
  }
}
