package io.b2mash.b2b.mailprovisioning.notification;

import io.b2mash.b2b.mailprovisioning.event.EmailAccountEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisionedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisioningFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Default consumer of email account lifecycle events. Runs AFTER_COMMIT so only committed changes
 * are reported, and a failure here never rolls back the account change. Hosts add their own
 * listeners (welcome mail, billing) next to this one.
 */
@Component
public class EmailAccountNotificationListener {

  private static final Logger log = LoggerFactory.getLogger(EmailAccountNotificationListener.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onEmailAccountEvent(EmailAccountEvent event) {
    try {
      if (event instanceof EmailAccountProvisioningFailedEvent failed) {
        log.warn(
            "{} account={} email={} provider={} error={}: {}",
            failed.eventType(),
            failed.accountId(),
            failed.emailAddress(),
            failed.provider(),
            failed.errorKind(),
            failed.errorMessage());
      } else if (event instanceof EmailAccountProvisionedEvent provisioned) {
        log.info(
            "{} account={} email={} provider={} externalId={}",
            provisioned.eventType(),
            provisioned.accountId(),
            provisioned.emailAddress(),
            provisioned.provider(),
            provisioned.externalId());
      } else {
        log.info(
            "{} account={} email={} provider={}",
            event.eventType(),
            event.accountId(),
            event.emailAddress(),
            event.provider());
      }
    } catch (Exception e) {
      log.warn(
          "Failed to handle {} event for account={}", event.eventType(), event.accountId(), e);
    }
  }
}
