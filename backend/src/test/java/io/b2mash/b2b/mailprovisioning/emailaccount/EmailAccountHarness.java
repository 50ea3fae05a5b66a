package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.credential.AesGcmPasswordCipher;
import io.b2mash.b2b.mailprovisioning.credential.CredentialProperties;
import io.b2mash.b2b.mailprovisioning.credential.PasswordGenerator;
import io.b2mash.b2b.mailprovisioning.credential.PasswordTokenStore;
import io.b2mash.b2b.mailprovisioning.integration.EmailProviderRegistry;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.FakeEmailProvider;
import io.b2mash.b2b.mailprovisioning.job.AsyncJob;
import io.b2mash.b2b.mailprovisioning.job.AsyncJobDispatcher;
import io.b2mash.b2b.mailprovisioning.job.ChangeMailboxPasswordJob;
import io.b2mash.b2b.mailprovisioning.job.DeleteRemoteMailboxJob;
import io.b2mash.b2b.mailprovisioning.job.ProvisionEmailAccountJob;
import io.b2mash.b2b.mailprovisioning.platform.ConfiguredMembershipLimitations;
import io.b2mash.b2b.mailprovisioning.platform.PlatformProperties;
import io.b2mash.b2b.mailprovisioning.platform.PlatformProperties.MembershipLimit;
import io.b2mash.b2b.mailprovisioning.quota.EmailAccountQuotaService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Wires the real email account services around an in-memory repository, recording dispatcher and
 * event list. Jobs are only run when a test calls {@link #runJobs()}.
 */
final class EmailAccountHarness {

  static final UUID CUSTOMER = UUID.fromString("0b5c2a4e-8d1f-4c53-9a7e-1f0e6d2c3b4a");
  static final UUID MEMBERSHIP = UUID.fromString("7f3e9d21-5a6b-4c8d-b1e2-3f4a5b6c7d8e");

  final InMemoryEmailAccountRepository accounts = new InMemoryEmailAccountRepository();
  final List<Object> events = new ArrayList<>();
  final List<AsyncJob> jobs = new ArrayList<>();
  final Set<UUID> unknownCustomers = new HashSet<>();
  final Map<UUID, MembershipLimit> memberships = new HashMap<>();

  final FakeEmailProvider purelymail = new FakeEmailProvider("purelymail");
  final FakeEmailProvider cpanel = new FakeEmailProvider("cpanel").missing("host");
  final EmailProviderRegistry registry = new EmailProviderRegistry();

  final PasswordTokenStore tokenStore =
      new PasswordTokenStore(
          new AesGcmPasswordCipher("test-site-secret"), new CredentialProperties(null, null));
  final PasswordGenerator passwordGenerator = new PasswordGenerator();

  EmailAccountProperties properties = new EmailAccountProperties(true, null, false);

  final EmailAccountLifecycle lifecycle;
  final EmailAccountProvisioner provisioner;

  EmailAccountHarness() {
    registry.register("purelymail", () -> purelymail);
    registry.register("cpanel", () -> cpanel);
    memberships.put(MEMBERSHIP, new MembershipLimit(true, "3"));
    lifecycle = new EmailAccountLifecycle(accounts.repository, events::add);
    provisioner =
        new EmailAccountProvisioner(
            accounts.repository, lifecycle, registry, tokenStore, passwordGenerator);
  }

  /** Builds the service against the current {@link #properties}. */
  EmailAccountService service() {
    var platform = new PlatformProperties(Set.of(), memberships);
    var quota =
        new EmailAccountQuotaService(
            accounts.repository, new ConfiguredMembershipLimitations(platform), properties);
    AsyncJobDispatcher dispatcher = jobs::add;
    return new EmailAccountService(
        accounts.repository,
        lifecycle,
        registry,
        quota,
        customerId -> !unknownCustomers.contains(customerId),
        tokenStore,
        passwordGenerator,
        dispatcher,
        events::add,
        properties);
  }

  static CreateEmailAccountCommand command(String emailAddress) {
    return new CreateEmailAccountCommand(
        CUSTOMER, MEMBERSHIP, null, emailAddress, null, "purelymail", null, null, null, null, null);
  }

  /** Runs queued jobs in order, including any they enqueue, as the async listener would. */
  void runJobs() {
    while (!jobs.isEmpty()) {
      var job = jobs.remove(0);
      if (job instanceof ProvisionEmailAccountJob provision) {
        provisioner.provision(provision);
      } else if (job instanceof DeleteRemoteMailboxJob delete) {
        provisioner.deleteRemote(delete);
      } else if (job instanceof ChangeMailboxPasswordJob change) {
        provisioner.changePassword(change);
      }
    }
  }

  <T> List<T> eventsOf(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast).toList();
  }
}
