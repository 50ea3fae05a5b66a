package io.b2mash.b2b.mailprovisioning.emailaccount;

import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.CUSTOMER;
import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.MEMBERSHIP;
import static io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountHarness.command;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.mailprovisioning.event.CustomerDeletedEvent;
import io.b2mash.b2b.mailprovisioning.event.MembershipDeletedEvent;
import io.b2mash.b2b.mailprovisioning.job.DeleteRemoteMailboxJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmailAccountCascadeListenerTest {

  private EmailAccountHarness harness;
  private EmailAccountService service;
  private EmailAccountCascadeListener listener;

  @BeforeEach
  void setUp() {
    harness = new EmailAccountHarness();
    service = harness.service();
    listener = new EmailAccountCascadeListener(service);
  }

  @Test
  void customerDeleted_removesAccountsAndDeletesMailboxes() {
    service.createAccount(command("a@example.com"));
    service.createAccount(command("b@example.com"));
    harness.runJobs();

    listener.onCustomerDeleted(new CustomerDeletedEvent(CUSTOMER));

    assertThat(harness.accounts.rows).isEmpty();
    assertThat(harness.jobs)
        .containsExactlyInAnyOrder(
            new DeleteRemoteMailboxJob("a@example.com", "purelymail"),
            new DeleteRemoteMailboxJob("b@example.com", "purelymail"));
    harness.runJobs();
    assertThat(harness.purelymail.deleted)
        .containsExactlyInAnyOrder("a@example.com", "b@example.com");
  }

  @Test
  void membershipDeleted_removesThatMembershipsAccounts() {
    service.createAccount(command("a@example.com"));

    listener.onMembershipDeleted(new MembershipDeletedEvent(MEMBERSHIP));

    assertThat(harness.accounts.rows).isEmpty();
  }
}
