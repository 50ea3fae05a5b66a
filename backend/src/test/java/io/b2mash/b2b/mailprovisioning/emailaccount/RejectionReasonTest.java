package io.b2mash.b2b.mailprovisioning.emailaccount;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RejectionReasonTest {

  private Locale defaultLocale;

  @BeforeEach
  void useTurkishLocale() {
    defaultLocale = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
  }

  @AfterEach
  void restoreLocale() {
    Locale.setDefault(defaultLocale);
  }

  @Test
  void codes_areStableUnderTurkishLocale() {
    assertThat(RejectionReason.INVALID_EMAIL.code()).isEqualTo("invalid_email");
    assertThat(RejectionReason.INVALID_CUSTOMER.code()).isEqualTo("invalid_customer");
    assertThat(RejectionReason.QUOTA_EXCEEDED.code()).isEqualTo("quota_exceeded");
  }
}
