package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.ConnectionTestResult;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * cPanel UAPI adapter. There is no session: every request re-authenticates, either with an API
 * token ({@code Authorization: cpanel user:token}) or with HTTP Basic. Mailbox name and domain are
 * sent as flat form parameters; a quota of 0 means unlimited.
 */
public class CpanelEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(CpanelEmailProvider.class);

  public static final String ID = "cpanel";

  static final int WEBMAIL_PORT = 2096;
  static final String SERVER_IP_PLACEHOLDER = "[Your Server IP]";

  private final CpanelProperties properties;
  private final RestClient restClient;
  private final RemoteErrorTranslator errors;

  public CpanelEmailProvider(
      CpanelProperties properties,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.restClient = restClientBuilder.build();
    this.errors = new RemoteErrorTranslator("cPanel", objectMapper);
  }

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public String title() {
    return "cPanel";
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

    var params = new LinkedMultiValueMap<String, String>();
    params.add("email", request.username());
    params.add("domain", request.domain());
    params.add("password", request.password());
    params.add("quota", String.valueOf(Math.max(request.quotaMb(), 0)));

    return uapi("add_pop", params)
        .map(
            data -> {
              log.info("cPanel mailbox created: {}", request.emailAddress());
              return new ProvisionedMailbox(
                  request.emailAddress(), request.emailAddress(), request.quotaMb());
            });
  }

  @Override
  public ProviderResult<Void> deleteEmailAccount(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    var address = MailboxAddress.parse(emailAddress);
    if (address.isEmpty()) {
      return invalidAddress(emailAddress);
    }
    var params = new LinkedMultiValueMap<String, String>();
    params.add("email", address.get().localPart());
    params.add("domain", address.get().domain());
    return uapi("delete_pop", params).map(data -> null);
  }

  @Override
  public ProviderResult<Void> changePassword(String emailAddress, String newPassword) {
    if (!isSetup()) {
      return notConfigured();
    }
    var address = MailboxAddress.parse(emailAddress);
    if (address.isEmpty()) {
      return invalidAddress(emailAddress);
    }
    if (ProviderSettings.isBlank(newPassword)) {
      return ProviderResult.failure(ProviderErrorKind.MISSING_PARAMS, "New password is required");
    }
    var params = new LinkedMultiValueMap<String, String>();
    params.add("email", address.get().localPart());
    params.add("domain", address.get().domain());
    params.add("password", newPassword);
    return uapi("passwd_pop", params).map(data -> null);
  }

  @Override
  public ProviderResult<MailboxInfo> getAccountInfo(String emailAddress) {
    if (!isSetup()) {
      return notConfigured();
    }
    var address = MailboxAddress.parse(emailAddress);
    if (address.isEmpty()) {
      return invalidAddress(emailAddress);
    }
    var params = new LinkedMultiValueMap<String, String>();
    params.add("domain", address.get().domain());

    return uapi("list_pops_with_disk", params)
        .flatMap(
            data -> {
              for (JsonNode pop : data) {
                if (address.get().emailAddress().equalsIgnoreCase(pop.path("email").asText())) {
                  return ProviderResult.success(toInfo(address.get(), pop));
                }
              }
              return ProviderResult.failure(
                  ProviderErrorKind.NOT_FOUND, "No cPanel mailbox " + address.get());
            });
  }

  @Override
  public String webmailUrl(MailboxAddress address) {
    return "https://" + properties.host() + ":" + WEBMAIL_PORT + "/";
  }

  @Override
  public List<DnsRecord> dnsInstructions(String domain) {
    return List.of(
        DnsRecord.mx("@", "mail." + domain, 10, "Mail exchanger record for receiving email."),
        DnsRecord.a("mail", SERVER_IP_PLACEHOLDER, "Points the mail host name at your server."),
        DnsRecord.txt(
            "@", "v=spf1 +a +mx ~all", "SPF record authorizing your server to send email."));
  }

  @Override
  public MailClientSettings imapSettings(MailboxAddress address) {
    return MailClientSettings.imap("mail." + address.domain(), address.emailAddress());
  }

  @Override
  public MailClientSettings smtpSettings(MailboxAddress address) {
    return MailClientSettings.smtp("mail." + address.domain(), address.emailAddress());
  }

  @Override
  public ConnectionTestResult testConnection() {
    if (!isSetup()) {
      return ConnectionTestResult.from(ID, notConfigured());
    }
    return ConnectionTestResult.from(ID, uapi("list_pops", new LinkedMultiValueMap<>()));
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public List<String> missingSettings() {
    return properties.missingSettings();
  }

  /** Calls one UAPI Email function. UAPI reports failures in the body with {@code status: 0}. */
  private ProviderResult<JsonNode> uapi(String function, MultiValueMap<String, String> params) {
    JsonNode body;
    try {
      body =
          restClient
              .post()
              .uri(baseUrl() + "/execute/Email/" + function)
              .header(HttpHeaders.AUTHORIZATION, authorization())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(params)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      var error = errors.translate(e);
      log.error("cPanel {} failed: {}", function, error.message());
      return ProviderResult.failure(error);
    }

    if (body == null) {
      return ProviderResult.failure(
          ProviderErrorKind.REMOTE_REJECTED, "Empty response from cPanel " + function);
    }
    if (body.path("status").asInt(0) != 1) {
      var message = joinErrors(body.path("errors"), function);
      log.error("cPanel {} rejected: {}", function, message);
      return ProviderResult.failure(kindFor(message), message);
    }
    return ProviderResult.success(body.path("data"));
  }

  private String baseUrl() {
    return "https://" + properties.host() + ":" + properties.port();
  }

  private String authorization() {
    if (properties.usesApiToken()) {
      return "cpanel " + properties.username() + ":" + properties.apiToken();
    }
    return "Basic "
        + HttpHeaders.encodeBasicAuth(
            properties.username(), properties.password(), StandardCharsets.UTF_8);
  }

  private static MailboxInfo toInfo(MailboxAddress address, JsonNode pop) {
    var rawQuota = pop.path("_diskquota").asText("0");
    int quotaMb = "unlimited".equalsIgnoreCase(rawQuota) ? 0 : (int) parseDouble(rawQuota);
    return new MailboxInfo(
        address.emailAddress(),
        quotaMb,
        parseDouble(pop.path("_diskused").asText("0")),
        pop.path("suspended_login").asInt(0) == 1,
        null);
  }

  private static double parseDouble(String raw) {
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static String joinErrors(JsonNode errors, String function) {
    if (!errors.isArray() || errors.isEmpty()) {
      return "cPanel " + function + " failed without an error message";
    }
    return StreamSupport.stream(errors.spliterator(), false)
        .map(JsonNode::asText)
        .collect(Collectors.joining(", "));
  }

  static ProviderErrorKind kindFor(String message) {
    var lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("not exist") || lower.contains("not found")) {
      return ProviderErrorKind.NOT_FOUND;
    }
    if (lower.contains("exists")) {
      return ProviderErrorKind.ALREADY_EXISTS;
    }
    if (lower.contains("access denied")) {
      return ProviderErrorKind.INVALID_CREDENTIALS;
    }
    return ProviderErrorKind.REMOTE_REJECTED;
  }

  private <T> ProviderResult<T> notConfigured() {
    return ProviderResult.failure(
        ProviderErrorKind.NOT_CONFIGURED, "cPanel is missing settings: " + missingSettings());
  }

  private static <T> ProviderResult<T> invalidAddress(String emailAddress) {
    return ProviderResult.failure(
        ProviderErrorKind.MISSING_PARAMS, "Not a valid email address: " + emailAddress);
  }
}
