package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PurelymailEmailProviderTest {

  private static final String API = "https://purelymail.com/api/v0/";
  private static final String OK = "{\"type\":\"success\",\"success\":true,\"result\":{}}";

  private MockRestServiceServer server;
  private PurelymailEmailProvider provider;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    provider =
        new PurelymailEmailProvider(
            new PurelymailProperties(true, "pm-key-1"), builder, new ObjectMapper());
  }

  @Test
  void createEmailAccount_addsDomainThenCreatesUser() {
    server
        .expect(requestTo(API + "addDomainName"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Purelymail-Api-Key", "pm-key-1"))
        .andExpect(jsonPath("$.domainName").value("example.com"))
        .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(API + "createUser"))
        .andExpect(jsonPath("$.userName").value("info@example.com"))
        .andExpect(jsonPath("$.password").value("S3cret!pass"))
        .andExpect(jsonPath("$.enablePasswordReset").value(false))
        .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

    var result =
        provider.createEmailAccount(
            new CreateMailboxRequest("info", "example.com", "S3cret!pass", 2048, null));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value().externalId()).isEqualTo("info@example.com");
    assertThat(result.value().quotaMb()).isZero();
    server.verify();
  }

  @Test
  void createEmailAccount_continuesWhenDomainAlreadyExists() {
    server
        .expect(requestTo(API + "addDomainName"))
        .andRespond(
            withSuccess(
                "{\"success\":false,\"message\":\"Domain already exists\"}",
                MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(API + "createUser"))
        .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

    var result =
        provider.createEmailAccount(
            new CreateMailboxRequest("info", "example.com", "S3cret!pass", 0, null));

    assertThat(result.isSuccess()).isTrue();
    server.verify();
  }

  @Test
  void createEmailAccount_reportsUserErrorAfterDomainError() {
    server
        .expect(requestTo(API + "addDomainName"))
        .andRespond(
            withSuccess(
                "{\"success\":false,\"message\":\"Domain ownership not verified\"}",
                MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(API + "createUser"))
        .andRespond(
            withSuccess(
                "{\"type\":\"error\",\"message\":\"User already exists\"}",
                MediaType.APPLICATION_JSON));

    var result =
        provider.createEmailAccount(
            new CreateMailboxRequest("info", "example.com", "S3cret!pass", 0, null));

    assertThat(result.error().kind()).isEqualTo(ProviderErrorKind.ALREADY_EXISTS);
    assertThat(result.error().message()).isEqualTo("User already exists");
  }

  @Test
  void changePassword_sendsPasswordField() {
    server
        .expect(requestTo(API + "modifyUser"))
        .andExpect(jsonPath("$.userName").value("info@example.com"))
        .andExpect(jsonPath("$.password").value("N3w!password"))
        .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

    assertThat(provider.changePassword("info@example.com", "N3w!password").isSuccess()).isTrue();
    server.verify();
  }

  @Test
  void deleteEmailAccount_mapsUnknownUserToNotFound() {
    server
        .expect(requestTo(API + "deleteUser"))
        .andRespond(
            withSuccess(
                "{\"success\":false,\"message\":\"User not found\"}", MediaType.APPLICATION_JSON));

    assertThat(provider.deleteEmailAccount("info@example.com").error().kind())
        .isEqualTo(ProviderErrorKind.NOT_FOUND);
  }

  @Test
  void testConnection_reportsRejectedKey() {
    server
        .expect(requestTo(API + "listDomainNames"))
        .andRespond(
            withStatus(HttpStatus.FORBIDDEN)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"type\":\"error\",\"message\":\"Invalid API key\"}"));

    var result = provider.testConnection();

    assertThat(result.success()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ProviderErrorKind.INVALID_CREDENTIALS);
    assertThat(result.errorMessage()).contains("Invalid API key");
  }

  @Test
  void getAccountInfo_blankAddressIsRejectedWithoutARequest() {
    var result = provider.getAccountInfo(" ");

    assertThat(result.error().kind()).isEqualTo(ProviderErrorKind.MISSING_PARAMS);
    server.verify();
  }

  @Test
  void missingApiKeyIsReported() {
    var builder = RestClient.builder();
    var unconfigured =
        new PurelymailEmailProvider(
            new PurelymailProperties(true, " "), builder, new ObjectMapper());

    assertThat(unconfigured.missingSettings()).containsExactly("api-key");
    assertThat(unconfigured.testConnection().errorKind())
        .isEqualTo(ProviderErrorKind.NOT_CONFIGURED);
  }

  @Test
  void dnsInstructionsIncludeDmarcReportAddress() {
    var records = provider.dnsInstructions("example.com");

    assertThat(records).extracting(DnsRecord::type).containsExactly("MX", "TXT", "CNAME", "TXT");
    assertThat(records.get(0).priority()).isEqualTo(10);
    assertThat(records.get(3).value()).contains("rua=mailto:dmarc@example.com");
  }
}
