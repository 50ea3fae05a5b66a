package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisionedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountProvisioningFailedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountReactivatedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountSuspendedEvent;
import io.b2mash.b2b.mailprovisioning.integration.ProviderError;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.ProvisionedMailbox;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only place an email account's status changes. Every method is a short read-modify-write
 * transaction; the {@code @Version} column makes a concurrent writer lose at commit. Lifecycle
 * events are published here, alongside the transition that causes them.
 */
@Service
public class EmailAccountLifecycle {

  private static final Logger log = LoggerFactory.getLogger(EmailAccountLifecycle.class);

  private final EmailAccountRepository emailAccountRepository;
  private final ApplicationEventPublisher eventPublisher;

  public EmailAccountLifecycle(
      EmailAccountRepository emailAccountRepository, ApplicationEventPublisher eventPublisher) {
    this.emailAccountRepository = emailAccountRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * PENDING → PROVISIONING. Returns empty, without changing anything, when the account is gone or
   * is no longer PENDING (a duplicate or late job delivery).
   */
  @Transactional
  public Optional<EmailAccount> beginProvisioning(UUID accountId) {
    var account = emailAccountRepository.findById(accountId);
    if (account.isEmpty()) {
      log.error("Email account {} disappeared before provisioning started", accountId);
      return Optional.empty();
    }
    if (account.get().getStatus() != EmailAccountStatus.PENDING) {
      log.warn(
          "Email account {} is {}, not PENDING; skipping provisioning",
          accountId,
          account.get().getStatus());
      return Optional.empty();
    }
    account.get().transitionTo(EmailAccountStatus.PROVISIONING);
    return Optional.of(emailAccountRepository.save(account.get()));
  }

  /** PROVISIONING → ACTIVE, recording what the provider reported. */
  @Transactional
  public Optional<EmailAccount> completeProvisioning(
      UUID accountId, ProvisionedMailbox mailbox, String passwordDisplayToken, String password) {
    var found = emailAccountRepository.findById(accountId);
    if (found.isEmpty()) {
      log.error(
          "Email account {} was deleted while provisioning; remote mailbox {} is orphaned",
          accountId,
          mailbox.emailAddress());
      return Optional.empty();
    }
    var account = found.get();
    account.recordProvisioned(mailbox.externalId(), mailbox.quotaMb());
    account.setPasswordDisplayToken(passwordDisplayToken);
    account.transitionTo(EmailAccountStatus.ACTIVE);
    var saved = emailAccountRepository.save(account);

    log.info(
        "Email account {} provisioned at {} (externalId={})",
        saved.getEmailAddress(),
        saved.getProvider(),
        saved.getExternalId());
    eventPublisher.publishEvent(
        new EmailAccountProvisionedEvent(
            saved.getId(),
            saved.getCustomerId(),
            saved.getEmailAddress(),
            saved.getProvider(),
            saved.getExternalId(),
            password,
            Instant.now()));
    return Optional.of(saved);
  }

  /**
   * PENDING or PROVISIONING → FAILED. No retry is scheduled. Returns empty, without changing
   * anything, when another job already moved the account past those states.
   */
  @Transactional
  public Optional<EmailAccount> failProvisioning(UUID accountId, ProviderError error) {
    var found = emailAccountRepository.findById(accountId);
    if (found.isEmpty()) {
      log.error("Email account {} not found while recording failure {}", accountId, error.code());
      return Optional.empty();
    }
    var account = found.get();
    if (!account.getStatus().canTransitionTo(EmailAccountStatus.FAILED)) {
      log.warn(
          "Email account {} is already {}; not recording failure {}",
          accountId,
          account.getStatus(),
          error.code());
      return Optional.empty();
    }
    account.transitionTo(EmailAccountStatus.FAILED);
    var saved = emailAccountRepository.save(account);

    eventPublisher.publishEvent(
        new EmailAccountProvisioningFailedEvent(
            saved.getId(),
            saved.getCustomerId(),
            saved.getEmailAddress(),
            saved.getProvider(),
            error.code(),
            error.message(),
            Instant.now()));
    return Optional.of(saved);
  }

  /** ACTIVE → SUSPENDED. */
  @Transactional
  public EmailAccount suspend(EmailAccount account) {
    account.transitionTo(EmailAccountStatus.SUSPENDED);
    var saved = emailAccountRepository.save(account);
    log.info("Email account {} suspended", saved.getEmailAddress());
    eventPublisher.publishEvent(
        new EmailAccountSuspendedEvent(
            saved.getId(),
            saved.getCustomerId(),
            saved.getEmailAddress(),
            saved.getProvider(),
            Instant.now()));
    return saved;
  }

  /** SUSPENDED → ACTIVE. */
  @Transactional
  public EmailAccount reactivate(EmailAccount account) {
    account.transitionTo(EmailAccountStatus.ACTIVE);
    var saved = emailAccountRepository.save(account);
    log.info("Email account {} reactivated", saved.getEmailAddress());
    eventPublisher.publishEvent(
        new EmailAccountReactivatedEvent(
            saved.getId(),
            saved.getCustomerId(),
            saved.getEmailAddress(),
            saved.getProvider(),
            Instant.now()));
    return saved;
  }

  /** FAILED → PENDING, ahead of a manual re-enqueue. */
  @Transactional
  public EmailAccount requeue(EmailAccount account) {
    account.transitionTo(EmailAccountStatus.PENDING);
    var saved = emailAccountRepository.save(account);
    log.info("Email account {} re-queued for provisioning", saved.getEmailAddress());
    return saved;
  }

  /** Replaces the one-time display token handle; {@code null} clears it. */
  @Transactional
  public void replacePasswordDisplayToken(UUID accountId, String passwordDisplayToken) {
    emailAccountRepository
        .findById(accountId)
        .ifPresent(
            account -> {
              account.setPasswordDisplayToken(passwordDisplayToken);
              emailAccountRepository.save(account);
            });
  }
}
