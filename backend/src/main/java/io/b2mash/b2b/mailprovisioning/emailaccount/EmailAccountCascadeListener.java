package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.event.CustomerDeletedEvent;
import io.b2mash.b2b.mailprovisioning.event.MembershipDeletedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Removes email accounts when the host deletes their customer or membership. Runs synchronously
 * inside the host's transaction, so the rows go with the owner; remote deletes are dispatched as
 * jobs and only run once that transaction commits.
 */
@Component
public class EmailAccountCascadeListener {

  private final EmailAccountService emailAccountService;

  public EmailAccountCascadeListener(EmailAccountService emailAccountService) {
    this.emailAccountService = emailAccountService;
  }

  @EventListener
  public void onCustomerDeleted(CustomerDeletedEvent event) {
    emailAccountService.deleteAllForCustomer(event.customerId());
  }

  @EventListener
  public void onMembershipDeleted(MembershipDeletedEvent event) {
    emailAccountService.deleteAllForMembership(event.membershipId());
  }
}
