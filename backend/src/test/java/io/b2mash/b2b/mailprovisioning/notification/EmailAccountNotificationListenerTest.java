package io.b2mash.b2b.mailprovisioning.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.b2mash.b2b.mailprovisioning.event.EmailAccountDeletedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisionedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisioningFailedEvent;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class EmailAccountNotificationListenerTest {

  private final EmailAccountNotificationListener listener = new EmailAccountNotificationListener();

  @Test
  void provisionedEventNeverPrintsPassword() {
    var event =
        new EmailAccountProvisionedEvent(
            UUID.randomUUID(),
            UUID.randomUUID(),
            "alice@example.com",
            "purelymail",
            "ext-alice",
            "Hunter2-secret!",
            Instant.now());

    assertThat(event.toString()).doesNotContain("Hunter2-secret!").contains("password=***");
    assertThat(event.eventType()).isEqualTo("email_account.provisioned");
    assertThatCode(() -> listener.onEmailAccountEvent(event)).doesNotThrowAnyException();
  }

  @Test
  void handlesEveryEventKind() {
    var failed =
        new EmailAccountProvisioningFailedEvent(
            UUID.randomUUID(),
            UUID.randomUUID(),
            "bob@example.com",
            "cpanel",
            "invalid_credentials",
            "Access denied",
            Instant.now());
    var deleted =
        new EmailAccountDeletedEvent(
            UUID.randomUUID(), UUID.randomUUID(), "bob@example.com", "cpanel", Instant.now());

    assertThatCode(() -> listener.onEmailAccountEvent(failed)).doesNotThrowAnyException();
    assertThatCode(() -> listener.onEmailAccountEvent(deleted)).doesNotThrowAnyException();
    assertThat(failed.eventType()).isEqualTo("email_account.provisioning_failed");
  }
}
