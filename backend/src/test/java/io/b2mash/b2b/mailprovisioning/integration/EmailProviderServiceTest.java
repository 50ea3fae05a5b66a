package io.b2mash.b2b.mailprovisioning.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.mailprovisioning.exception.ResourceNotFoundException;
import io.b2mash.b2b.mailprovisioning.integration.EmailProviderService.ProviderSummary;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.FakeEmailProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmailProviderServiceTest {

  private EmailProviderService service;

  @BeforeEach
  void setUp() {
    var registry = new EmailProviderRegistry();
    registry.register("purelymail", () -> new FakeEmailProvider("purelymail"));
    registry.register("cpanel", () -> new FakeEmailProvider("cpanel").missing("host"));
    registry.register("microsoft365", () -> new FakeEmailProvider("microsoft365").disabled());
    service = new EmailProviderService(registry);
  }

  @Test
  void listProviders_filtersToUsable() {
    assertThat(service.listProviders(true))
        .extracting(ProviderSummary::id)
        .containsExactly("purelymail");
    assertThat(service.listProviders(false))
        .extracting(ProviderSummary::id)
        .containsExactly("purelymail", "cpanel", "microsoft365");
  }

  @Test
  void testConnection_reportsMissingSettingsWithoutCallingProvider() {
    var result = service.testConnection("cpanel");

    assertThat(result.success()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ProviderErrorKind.NOT_CONFIGURED);
    assertThat(result.errorMessage()).contains("host");
    assertThat(service.testConnection("microsoft365").errorMessage()).contains("disabled");
    assertThat(service.testConnection("purelymail").success()).isTrue();
  }

  @Test
  void dnsInstructions_normalizesDomain() {
    assertThat(service.dnsInstructions("purelymail", " Example.COM ").get(0).value())
        .isEqualTo("mx.example.com");
    assertThatThrownBy(() -> service.dnsInstructions("purelymail", " "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownProviderIsNotFound() {
    assertThatThrownBy(() -> service.testConnection("exchange"))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
