package io.b2mash.b2b.mailprovisioning.emailaccount;

import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.CUSTOMER;
import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.MEMBERSHIP;
import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.command;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.mailprovisioning.event.EmailAccountCreatedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountDeletedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountReactivatedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountSuspendedEvent;
import io.b2mash.b2b.mailprovisioning.exception.InvalidStateException;
import io.b2mash.b2b.mailprovisioning.exception.ResourceNotFoundException;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import io.b2mash.b2b.mailprovisioning.job.ChangeMailboxPasswordJob;
import io.b2mash.b2b.mailprovisioning.job.DeleteRemoteMailboxJob;
import io.b2mash.b2b.mailprovisioning.job.ProvisionEmailAccountJob;
import io.b2mash.b2b.mailprovisioning.platform.PlatformProperties.MembershipLimit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmailAccountServiceTest {

  private EmailAccountHarness harness;
  private EmailAccountService service;

  @BeforeEach
  void setUp() {
    harness = new EmailAccountHarness();
    service = harness.service();
  }

  @Test
  void createAccount_recordsPendingRowAndQueuesProvisioning() {
    var account = service.createAccount(command("Alice@Example.com"));

    assertThat(account.getStatus()).isEqualTo(EmailAccountStatus.PENDING);
    assertThat(account.getEmailAddress()).isEqualTo("alice@example.com");
    assertThat(account.getDomain()).isEqualTo("example.com");
    assertThat(account.getQuotaMb()).isEqualTo(1024);
    assertThat(account.getExternalId()).isNull();
    assertThat(harness.jobs).containsExactly(new ProvisionEmailAccountJob(account.getId()));
    assertThat(harness.eventsOf(EmailAccountCreatedEvent.class)).hasSize(1);
    // nothing reaches the provider on the request path
    assertThat(harness.purelymail.created).isEmpty();
  }

  @Test
  void createAccount_stashesCallerPasswordForTheJob() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "bob@example.com",
            "example.com",
            "purelymail",
            null,
            2048,
            "Sup3r-secret!",
            "Bob",
            null);

    var account = service.createAccount(command);

    assertThat(account.getQuotaMb()).isEqualTo(2048);
    assertThat(account.getDisplayName()).isEqualTo("Bob");
    assertThat(harness.tokenStore.claim(account.getId())).contains("Sup3r-secret!");
  }

  @Test
  void createAccount_generatesPasswordWhenNoneGiven() {
    var account = service.createAccount(command("carol@example.com"));

    assertThat(harness.tokenStore.claim(account.getId()))
        .hasValueSatisfying(password -> assertThat(password).hasSize(16));
  }

  @Test
  void createAccount_rejectsWhenFeatureDisabled() {
    harness.properties = new EmailAccountProperties(false, null, false);
    service = harness.service();

    assertRejected(command("alice@example.com"), RejectionReason.FEATURE_DISABLED);
  }

  @Test
  void createAccount_rejectsUnknownCustomer() {
    harness.unknownCustomers.add(CUSTOMER);

    assertRejected(command("alice@example.com"), RejectionReason.INVALID_CUSTOMER);
  }

  @Test
  void createAccount_rejectsProviderThatIsNotSetUp() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "alice@example.com",
            null,
            "cpanel",
            null,
            null,
            null,
            null,
            null);

    assertRejected(command, RejectionReason.INVALID_PROVIDER);
  }

  @Test
  void createAccount_rejectsUnregisteredProvider() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "alice@example.com",
            null,
            "zoho",
            null,
            null,
            null,
            null,
            null);

    assertRejected(command, RejectionReason.INVALID_PROVIDER);
  }

  @Test
  void createAccount_rejectsMalformedAddress() {
    assertRejected(command("not-an-address"), RejectionReason.INVALID_EMAIL);
  }

  @Test
  void createAccount_rejectsDomainThatDoesNotMatchAddress() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "alice@example.com",
            "example.org",
            "purelymail",
            null,
            null,
            null,
            null,
            null);

    assertRejected(command, RejectionReason.DOMAIN_MISMATCH);
  }

  @Test
  void createAccount_rejectsDuplicateAddressIgnoringCase() {
    service.createAccount(command("alice@example.com"));
    harness.jobs.clear();

    assertRejected(command("ALICE@example.COM"), RejectionReason.EMAIL_EXISTS);
    assertThat(harness.accounts.rows).hasSize(1);
    assertThat(harness.jobs).isEmpty();
  }

  @Test
  void createAccount_allowsUpToLimitThenRejects() {
    service.createAccount(command("a@example.com"));
    service.createAccount(command("b@example.com"));
    service.createAccount(command("c@example.com"));

    assertRejected(command("d@example.com"), RejectionReason.QUOTA_EXCEEDED);
    assertThat(harness.accounts.rows).hasSize(3);
  }

  @Test
  void createAccount_failedAccountsDoNotCountAgainstLimit() {
    harness.memberships.put(MEMBERSHIP, new MembershipLimit(true, "1"));
    service = harness.service();
    harness.purelymail.onCreate(
        request -> ProviderResult.failure(ProviderErrorKind.REMOTE_REJECTED, "nope"));
    service.createAccount(command("a@example.com"));
    harness.runJobs();

    var second = service.createAccount(command("b@example.com"));

    assertThat(second.getStatus()).isEqualTo(EmailAccountStatus.PENDING);
  }

  @Test
  void createAccount_rejectsWhenMembershipLimitationDisabled() {
    harness.memberships.put(MEMBERSHIP, new MembershipLimit(false, "10"));
    service = harness.service();

    assertRejected(command("alice@example.com"), RejectionReason.QUOTA_EXCEEDED);
  }

  @Test
  void createAccount_rejectsMembershipIncludedWithoutMembership() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            null,
            null,
            "alice@example.com",
            null,
            "purelymail",
            null,
            null,
            null,
            null,
            null);

    assertRejected(command, RejectionReason.QUOTA_EXCEEDED);
  }

  @Test
  void createAccount_perAccountPurchaseRequiresSwitch() {
    var command = perAccountPurchase("alice@example.com");

    assertRejected(command, RejectionReason.PURCHASE_NOT_ALLOWED);
  }

  @Test
  void createAccount_perAccountPurchaseBypassesMembershipLimit() {
    harness.properties = new EmailAccountProperties(true, null, true);
    harness.memberships.put(MEMBERSHIP, new MembershipLimit(true, "false"));
    service = harness.service();
    var paymentId = UUID.randomUUID();
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "alice@example.com",
            null,
            "purelymail",
            PurchaseType.PER_ACCOUNT_PURCHASE,
            null,
            null,
            null,
            paymentId);

    var account = service.createAccount(command);

    assertThat(account.isPerAccountPurchase()).isTrue();
    assertThat(account.getPaymentId()).isEqualTo(paymentId);
  }

  @Test
  void get_unknownIdThrowsNotFound() {
    assertThatThrownBy(() -> service.get(UUID.randomUUID()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void listByCustomer_returnsOldestFirst() {
    var first = service.createAccount(command("a@example.com"));
    var second = service.createAccount(command("b@example.com"));

    assertThat(service.listByCustomer(CUSTOMER))
        .extracting(EmailAccount::getId)
        .containsExactly(first.getId(), second.getId());
    assertThat(service.listByMembership(MEMBERSHIP)).hasSize(2);
    assertThat(service.listByCustomer(UUID.randomUUID())).isEmpty();
  }

  @Test
  void deleteAccount_refusedWhileProvisioning() {
    var account = service.createAccount(command("alice@example.com"));
    harness.lifecycle.beginProvisioning(account.getId());

    assertThatThrownBy(() -> service.deleteAccount(account.getId()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(harness.accounts.rows).containsKey(account.getId());
  }

  @Test
  void deleteAccount_activeAccountQueuesRemoteDelete() {
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();

    service.deleteAccount(account.getId());

    assertThat(harness.accounts.rows).isEmpty();
    assertThat(harness.jobs)
        .containsExactly(new DeleteRemoteMailboxJob("alice@example.com", "purelymail"));
    assertThat(harness.eventsOf(EmailAccountDeletedEvent.class)).hasSize(1);
  }

  @Test
  void deleteAccount_pendingAccountHasNothingRemoteToDelete() {
    var account = service.createAccount(command("alice@example.com"));
    harness.jobs.clear();

    service.deleteAccount(account.getId());

    assertThat(harness.accounts.rows).isEmpty();
    assertThat(harness.jobs).isEmpty();
    assertThat(harness.tokenStore.claim(account.getId())).isEmpty();
  }

  @Test
  void deleteAccount_requeuedAfterFailedCreateStillQueuesRemoteDelete() {
    harness.purelymail.onCreate(
        request -> ProviderResult.failure(ProviderErrorKind.REMOTE_UNREACHABLE, "read timed out"));
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();
    service.retryProvisioning(account.getId());
    harness.jobs.clear();

    service.deleteAccount(account.getId());

    assertThat(harness.jobs)
        .containsExactly(new DeleteRemoteMailboxJob("alice@example.com", "purelymail"));
  }

  @Test
  void deleteAccount_failedBeforeAnyRemoteCallHasNothingRemoteToDelete() {
    var account = service.createAccount(command("alice@example.com"));
    harness.purelymail.disabled();
    harness.runJobs();

    service.deleteAccount(account.getId());

    assertThat(account.getStatus()).isEqualTo(EmailAccountStatus.FAILED);
    assertThat(harness.jobs).isEmpty();
  }

  @Test
  void deleteAccount_freesQuotaSlot() {
    harness.memberships.put(MEMBERSHIP, new MembershipLimit(true, "1"));
    service = harness.service();
    var account = service.createAccount(command("a@example.com"));
    service.deleteAccount(account.getId());

    var replacement = service.createAccount(command("b@example.com"));

    assertThat(replacement.getStatus()).isEqualTo(EmailAccountStatus.PENDING);
  }

  @Test
  void suspendAndReactivate_publishEvents() {
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();

    assertThat(service.suspend(account.getId()).getStatus())
        .isEqualTo(EmailAccountStatus.SUSPENDED);
    assertThat(service.reactivate(account.getId()).getStatus())
        .isEqualTo(EmailAccountStatus.ACTIVE);
    assertThat(harness.eventsOf(EmailAccountSuspendedEvent.class)).hasSize(1);
    assertThat(harness.eventsOf(EmailAccountReactivatedEvent.class)).hasSize(1);
  }

  @Test
  void suspend_pendingAccountIsIllegal() {
    var account = service.createAccount(command("alice@example.com"));

    assertThatThrownBy(() -> service.suspend(account.getId()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(account.getStatus()).isEqualTo(EmailAccountStatus.PENDING);
  }

  @Test
  void retryProvisioning_requeuesFailedAccount() {
    harness.purelymail.onCreate(
        request -> ProviderResult.failure(ProviderErrorKind.REMOTE_UNREACHABLE, "timeout"));
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();
    assertThat(account.getStatus()).isEqualTo(EmailAccountStatus.FAILED);

    var retried = service.retryProvisioning(account.getId());

    assertThat(retried.getStatus()).isEqualTo(EmailAccountStatus.PENDING);
    assertThat(harness.jobs).containsExactly(new ProvisionEmailAccountJob(account.getId()));
  }

  @Test
  void retryProvisioning_activeAccountIsIllegal() {
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();

    assertThatThrownBy(() -> service.retryProvisioning(account.getId()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(harness.jobs).isEmpty();
  }

  @Test
  void changePassword_requiresActiveAccount() {
    var account = service.createAccount(command("alice@example.com"));
    harness.jobs.clear();

    assertThatThrownBy(() -> service.changePassword(account.getId(), "N3w-password!"))
        .isInstanceOf(InvalidStateException.class);
    assertThat(harness.jobs).isEmpty();
  }

  @Test
  void changePassword_queuesJobWithStashedPassword() {
    var account = service.createAccount(command("alice@example.com"));
    harness.runJobs();

    service.changePassword(account.getId(), "N3w-password!");

    assertThat(harness.jobs).containsExactly(new ChangeMailboxPasswordJob(account.getId()));
    assertThat(harness.tokenStore.claim(account.getId())).contains("N3w-password!");
  }

  @Test
  void revealPassword_worksOnceAndClearsHandle() {
    var command =
        new CreateEmailAccountCommand(
            CUSTOMER,
            MEMBERSHIP,
            null,
            "alice@example.com",
            null,
            "purelymail",
            null,
            null,
            "Initial-pass1!",
            null,
            null);
    var account = service.createAccount(command);
    harness.runJobs();
    var token = account.getPasswordDisplayToken();

    assertThat(service.revealPassword(account.getId(), token)).isEqualTo("Initial-pass1!");
    assertThat(account.getPasswordDisplayToken()).isNull();
    assertThatThrownBy(() -> service.revealPassword(account.getId(), token))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void revealPassword_tokenOfAnotherAccountIsRejected() {
    var alice = service.createAccount(command("alice@example.com"));
    var bob = service.createAccount(command("bob@example.com"));
    harness.runJobs();

    assertThatThrownBy(() -> service.revealPassword(bob.getId(), alice.getPasswordDisplayToken()))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThat(service.revealPassword(alice.getId(), alice.getPasswordDisplayToken())).isNotBlank();
  }

  @Test
  void clientSettings_comeFromTheAccountsProvider() {
    var account = service.createAccount(command("alice@example.com"));

    var settings = service.clientSettings(account.getId());

    assertThat(settings.webmailUrl()).isEqualTo("https://webmail.example.com/");
    assertThat(settings.imap().server()).isEqualTo("imap.example.com");
    assertThat(settings.smtp().server()).isEqualTo("smtp.example.com");
  }

  @Test
  void deleteAllForCustomer_removesEveryAccountAndQueuesRemoteDeletes() {
    var active = service.createAccount(command("a@example.com"));
    harness.runJobs();
    service.createAccount(command("b@example.com"));
    harness.jobs.clear();

    int removed = service.deleteAllForCustomer(CUSTOMER);

    assertThat(removed).isEqualTo(2);
    assertThat(harness.accounts.rows).isEmpty();
    assertThat(harness.jobs)
        .containsExactly(new DeleteRemoteMailboxJob(active.getEmailAddress(), "purelymail"));
    assertThat(harness.eventsOf(EmailAccountDeletedEvent.class)).hasSize(2);
  }

  @Test
  void deleteAllForMembership_ignoresOtherMemberships() {
    service.createAccount(command("a@example.com"));

    assertThat(service.deleteAllForMembership(UUID.randomUUID())).isZero();
    assertThat(harness.accounts.rows).hasSize(1);
  }

  private void assertRejected(CreateEmailAccountCommand command, RejectionReason reason) {
    int before = harness.accounts.rows.size();

    assertThatThrownBy(() -> service.createAccount(command))
        .isInstanceOfSatisfying(
            EmailAccountRejectedException.class,
            e -> assertThat(e.getReason()).isEqualTo(reason));
    assertThat(harness.accounts.rows).hasSize(before);
  }

  private static CreateEmailAccountCommand perAccountPurchase(String emailAddress) {
    return new CreateEmailAccountCommand(
        CUSTOMER,
        MEMBERSHIP,
        null,
        emailAddress,
        null,
        "purelymail",
        PurchaseType.PER_ACCOUNT_PURCHASE,
        null,
        null,
        null,
        null);
  }
}
