package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.credential.PasswordGenerator;
import io.b2mash.b2b.mailprovisioning.credential.PasswordTokenStore;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountCreatedEvent;
import io.b2mash.b2b.mailprovisioning.event.EmailAccountDeletedEvent;
import io.b2mash.b2b.mailprovisioning.exception.InvalidStateException;
import io.b2mash.b2b.mailprovisioning.exception.ResourceNotFoundException;
import io.b2mash.b2b.mailprovisioning.integration.EmailProviderRegistry;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.EmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.MailboxAddress;
import io.b2mash.b2b.mailprovisioning.job.AsyncJobDispatcher;
import io.b2mash.b2b.mailprovisioning.job.ChangeMailboxPasswordJob;
import io.b2mash.b2b.mailprovisioning.job.DeleteRemoteMailboxJob;
import io.b2mash.b2b.mailprovisioning.job.ProvisionEmailAccountJob;
import io.b2mash.b2b.mailprovisioning.platform.CustomerDirectory;
import io.b2mash.b2b.mailprovisioning.quota.EmailAccountQuotaService;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Request-path email account operations. Nothing here calls a provider: remote work is handed to
 * {@link AsyncJobDispatcher} and runs in {@link EmailAccountProvisioner} after the transaction
 * commits.
 */
@Service
public class EmailAccountService {

  private static final Logger log = LoggerFactory.getLogger(EmailAccountService.class);

  private final EmailAccountRepository emailAccountRepository;
  private final EmailAccountLifecycle lifecycle;
  private final EmailProviderRegistry providerRegistry;
  private final EmailAccountQuotaService quotaService;
  private final CustomerDirectory customerDirectory;
  private final PasswordTokenStore passwordTokenStore;
  private final PasswordGenerator passwordGenerator;
  private final AsyncJobDispatcher jobDispatcher;
  private final ApplicationEventPublisher eventPublisher;
  private final EmailAccountProperties properties;

  public EmailAccountService(
      EmailAccountRepository emailAccountRepository,
      EmailAccountLifecycle lifecycle,
      EmailProviderRegistry providerRegistry,
      EmailAccountQuotaService quotaService,
      CustomerDirectory customerDirectory,
      PasswordTokenStore passwordTokenStore,
      PasswordGenerator passwordGenerator,
      AsyncJobDispatcher jobDispatcher,
      ApplicationEventPublisher eventPublisher,
      EmailAccountProperties properties) {
    this.emailAccountRepository = emailAccountRepository;
    this.lifecycle = lifecycle;
    this.providerRegistry = providerRegistry;
    this.quotaService = quotaService;
    this.customerDirectory = customerDirectory;
    this.passwordTokenStore = passwordTokenStore;
    this.passwordGenerator = passwordGenerator;
    this.jobDispatcher = jobDispatcher;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  /**
   * Validates and records a new account in PENDING, stashes its password for the provisioning
   * job and enqueues that job. Returns before anything happens at the provider.
   *
   * @throws EmailAccountRejectedException when validation or admission control fails; nothing is
   *     written in that case
   */
  @Transactional
  public EmailAccount createAccount(CreateEmailAccountCommand command) {
    if (!properties.enabled()) {
      throw reject(RejectionReason.FEATURE_DISABLED, "Email accounts are not enabled");
    }
    if (command.customerId() == null || !customerDirectory.exists(command.customerId())) {
      throw reject(RejectionReason.INVALID_CUSTOMER, "Customer not found: " + command.customerId());
    }
    var provider = providerRegistry.find(command.provider());
    if (provider.isEmpty() || !provider.get().isUsable()) {
      throw reject(
          RejectionReason.INVALID_PROVIDER,
          "Email provider '" + command.provider() + "' is not available");
    }
    var address =
        MailboxAddress.parse(command.emailAddress())
            .orElseThrow(
                () ->
                    reject(
                        RejectionReason.INVALID_EMAIL,
                        "Not a valid email address: " + command.emailAddress()));
    if (command.domain() != null
        && !command.domain().isBlank()
        && !command.domain().trim().toLowerCase(Locale.ROOT).equals(address.domain())) {
      throw reject(
          RejectionReason.DOMAIN_MISMATCH,
          "Domain " + command.domain() + " does not match " + address.emailAddress());
    }
    if (emailAccountRepository.existsByEmailAddress(address.emailAddress())) {
      throw reject(
          RejectionReason.EMAIL_EXISTS, "Email address already in use: " + address.emailAddress());
    }
    if (command.purchaseType() == PurchaseType.PER_ACCOUNT_PURCHASE
        && !properties.perAccountPurchaseEnabled()) {
      throw reject(
          RejectionReason.PURCHASE_NOT_ALLOWED, "Email accounts cannot be purchased individually");
    }
    if (command.purchaseType() == PurchaseType.MEMBERSHIP_INCLUDED
        && !quotaService.canCreateAccount(command.customerId(), command.membershipId())) {
      throw reject(
          RejectionReason.QUOTA_EXCEEDED,
          "Membership "
              + command.membershipId()
              + " does not allow another email account for this customer");
    }

    int quotaMb =
        command.quotaMb() != null && command.quotaMb() >= 0
            ? command.quotaMb()
            : properties.defaultQuotaMb();
    var account =
        new EmailAccount(
            address,
            command.customerId(),
            command.membershipId(),
            command.siteId(),
            command.provider(),
            quotaMb,
            command.purchaseType());
    account.setDisplayName(command.displayName());
    account.setPaymentId(command.paymentId());
    var saved = emailAccountRepository.save(account);

    var password =
        command.password() == null || command.password().isBlank()
            ? passwordGenerator.generate()
            : command.password();
    passwordTokenStore.stash(saved.getId(), password);
    jobDispatcher.dispatch(new ProvisionEmailAccountJob(saved.getId()));

    log.info(
        "Email account {} created for customer {} at {}",
        saved.getEmailAddress(),
        saved.getCustomerId(),
        saved.getProvider());
    eventPublisher.publishEvent(
        new EmailAccountCreatedEvent(
            saved.getId(),
            saved.getCustomerId(),
            saved.getEmailAddress(),
            saved.getProvider(),
            Instant.now()));
    return saved;
  }

  @Transactional(readOnly = true)
  public EmailAccount get(UUID id) {
    return emailAccountRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("EmailAccount", id));
  }

  @Transactional(readOnly = true)
  public List<EmailAccount> listByCustomer(UUID customerId) {
    return emailAccountRepository.findByCustomerIdOrderByCreatedAtAsc(customerId);
  }

  @Transactional(readOnly = true)
  public List<EmailAccount> listByMembership(UUID membershipId) {
    return emailAccountRepository.findByMembershipIdOrderByCreatedAtAsc(membershipId);
  }

  @Transactional(readOnly = true)
  public List<EmailAccount> listBySite(UUID siteId) {
    return emailAccountRepository.findBySiteIdOrderByCreatedAtAsc(siteId);
  }

  /**
   * Removes the account locally and enqueues a best-effort remote delete. Refused while a
   * provisioning job is in flight.
   */
  @Transactional
  public void deleteAccount(UUID id) {
    var account = get(id);
    if (account.getStatus() == EmailAccountStatus.PROVISIONING) {
      throw new InvalidStateException(
          "Email account is being provisioned",
          "Cannot delete " + account.getEmailAddress() + " until provisioning finishes");
    }
    remove(account);
  }

  @Transactional
  public EmailAccount suspend(UUID id) {
    return lifecycle.suspend(get(id));
  }

  @Transactional
  public EmailAccount reactivate(UUID id) {
    return lifecycle.reactivate(get(id));
  }

  /** FAILED → PENDING and a fresh provisioning job. A new password is generated by the job. */
  @Transactional
  public EmailAccount retryProvisioning(UUID id) {
    var account = lifecycle.requeue(get(id));
    jobDispatcher.dispatch(new ProvisionEmailAccountJob(account.getId()));
    return account;
  }

  /**
   * Stages a password change for an ACTIVE account. The provider call happens in the job; on
   * success a new one-time display token replaces the old one.
   */
  @Transactional
  public void changePassword(UUID id, String newPassword) {
    var account = get(id);
    if (!account.isActive()) {
      throw new InvalidStateException(
          "Email account not active",
          "Password can only be changed for active accounts; "
              + account.getEmailAddress()
              + " is "
              + account.getStatus());
    }
    var password =
        newPassword == null || newPassword.isBlank() ? passwordGenerator.generate() : newPassword;
    passwordTokenStore.stash(account.getId(), password);
    jobDispatcher.dispatch(new ChangeMailboxPasswordJob(account.getId()));
    log.info("Password change requested for {}", account.getEmailAddress());
  }

  /**
   * Returns the account's password exactly once for a matching one-time token.
   *
   * @throws ResourceNotFoundException if the token is unknown, expired, already used or belongs to
   *     another account
   */
  @Transactional
  public String revealPassword(UUID id, String token) {
    var account = get(id);
    var password =
        passwordTokenStore
            .consume(token, account.getId())
            .orElseThrow(ResourceNotFoundException::passwordToken);
    if (token.equals(account.getPasswordDisplayToken())) {
      lifecycle.replacePasswordDisplayToken(account.getId(), null);
    }
    return password;
  }

  @Transactional(readOnly = true)
  public MailClientConfiguration clientSettings(UUID id) {
    var account = get(id);
    var provider = requireProvider(account.getProvider());
    var address = account.address();
    return new MailClientConfiguration(
        provider.webmailUrl(address),
        provider.imapSettings(address),
        provider.smtpSettings(address));
  }

  /** Cascade for a deleted customer. Returns how many accounts were removed. */
  @Transactional
  public int deleteAllForCustomer(UUID customerId) {
    var accounts = emailAccountRepository.findByCustomerIdOrderByCreatedAtAsc(customerId);
    accounts.forEach(this::remove);
    if (!accounts.isEmpty()) {
      log.info("Removed {} email account(s) of deleted customer {}", accounts.size(), customerId);
    }
    return accounts.size();
  }

  /** Cascade for a deleted membership. Returns how many accounts were removed. */
  @Transactional
  public int deleteAllForMembership(UUID membershipId) {
    var accounts = emailAccountRepository.findByMembershipIdOrderByCreatedAtAsc(membershipId);
    accounts.forEach(this::remove);
    if (!accounts.isEmpty()) {
      log.info(
          "Removed {} email account(s) of deleted membership {}", accounts.size(), membershipId);
    }
    return accounts.size();
  }

  private void remove(EmailAccount account) {
    emailAccountRepository.delete(account);
    passwordTokenStore.claim(account.getId());
    passwordTokenStore.discard(account.getPasswordDisplayToken());
    if (account.isRemoteCreateAttempted()) {
      jobDispatcher.dispatch(
          new DeleteRemoteMailboxJob(account.getEmailAddress(), account.getProvider()));
    }
    log.info("Email account {} deleted ({})", account.getEmailAddress(), account.getStatus());
    eventPublisher.publishEvent(
        new EmailAccountDeletedEvent(
            account.getId(),
            account.getCustomerId(),
            account.getEmailAddress(),
            account.getProvider(),
            Instant.now()));
  }

  private EmailProvider requireProvider(String providerId) {
    return providerRegistry
        .find(providerId)
        .orElseThrow(() -> ResourceNotFoundException.provider(providerId));
  }

  private static EmailAccountRejectedException reject(RejectionReason reason, String detail) {
    log.info("Email account request rejected [{}]: {}", reason.code(), detail);
    return new EmailAccountRejectedException(reason, detail);
  }
}
