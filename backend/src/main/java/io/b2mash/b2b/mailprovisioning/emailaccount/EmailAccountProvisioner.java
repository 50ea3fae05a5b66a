package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.credential.PasswordGenerator;
import io.b2mash.b2b.mailprovisioning.credential.PasswordTokenStore;
import io.b2mash.b2b.mailprovisioning.integration.EmailProviderRegistry;
import io.b2mash.b2b.mailprovisioning.integration.ProviderError;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.CreateMailboxRequest;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.EmailProvider;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.ProvisionedMailbox;
import io.b2mash.b2b.mailprovisioning.job.ChangeMailboxPasswordJob;
import io.b2mash.b2b.mailprovisioning.job.DeleteRemoteMailboxJob;
import io.b2mash.b2b.mailprovisioning.job.ProvisionEmailAccountJob;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

/**
 * Handlers for the async email-account jobs. Provider calls happen here, outside any transaction;
 * status changes go through {@link EmailAccountLifecycle} before and after each remote call.
 * Remote failures are terminal for the attempt: nothing is retried automatically.
 */
@Service
public class EmailAccountProvisioner {

  private static final Logger log = LoggerFactory.getLogger(EmailAccountProvisioner.class);

  private final EmailAccountRepository emailAccountRepository;
  private final EmailAccountLifecycle lifecycle;
  private final EmailProviderRegistry providerRegistry;
  private final PasswordTokenStore passwordTokenStore;
  private final PasswordGenerator passwordGenerator;

  public EmailAccountProvisioner(
      EmailAccountRepository emailAccountRepository,
      EmailAccountLifecycle lifecycle,
      EmailProviderRegistry providerRegistry,
      PasswordTokenStore passwordTokenStore,
      PasswordGenerator passwordGenerator) {
    this.emailAccountRepository = emailAccountRepository;
    this.lifecycle = lifecycle;
    this.providerRegistry = providerRegistry;
    this.passwordTokenStore = passwordTokenStore;
    this.passwordGenerator = passwordGenerator;
  }

  /**
   * Creates the mailbox at the provider. Only a PENDING account is acted on, so a second delivery
   * of the same job after the first moved the account on is a no-op.
   */
  public void provision(ProvisionEmailAccountJob job) {
    var accountId = job.accountId();
    var snapshot = emailAccountRepository.findById(accountId);
    if (snapshot.isEmpty()) {
      log.error("Cannot provision email account {}: not found", accountId);
      return;
    }
    if (snapshot.get().getStatus() != EmailAccountStatus.PENDING) {
      log.warn(
          "Email account {} already {}; ignoring duplicate provisioning job",
          accountId,
          snapshot.get().getStatus());
      return;
    }

    var providerId = snapshot.get().getProvider();
    var provider = providerRegistry.find(providerId).filter(EmailProvider::isUsable);
    if (provider.isEmpty()) {
      log.error(
          "Cannot provision {}: provider {} is not registered, enabled and set up",
          snapshot.get().getEmailAddress(),
          providerId);
      passwordTokenStore.claim(accountId);
      lifecycle.failProvisioning(
          accountId,
          new ProviderError(
              ProviderErrorKind.NOT_CONFIGURED,
              "Provider " + providerId + " is not available"));
      return;
    }

    Optional<EmailAccount> started;
    try {
      started = lifecycle.beginProvisioning(accountId);
    } catch (OptimisticLockingFailureException e) {
      log.warn("Email account {} was claimed by a concurrent provisioning job", accountId);
      return;
    }
    if (started.isEmpty()) {
      return;
    }
    var account = started.get();

    var password =
        passwordTokenStore
            .claim(accountId)
            .orElseGet(
                () -> {
                  log.warn(
                      "No stashed password for {}; generating a new one",
                      account.getEmailAddress());
                  return passwordGenerator.generate();
                });

    var request =
        new CreateMailboxRequest(
            account.username(),
            account.getDomain(),
            password,
            account.getQuotaMb(),
            account.getDisplayName());
    var result = createRemote(provider.get(), request);

    if (!result.isSuccess()) {
      var error = result.error();
      log.error(
          "Provisioning {} at {} failed [{}]: {}",
          account.getEmailAddress(),
          providerId,
          error.code(),
          error.message());
      lifecycle.failProvisioning(accountId, error);
      return;
    }

    var displayToken = passwordTokenStore.store(accountId, password);
    var completed =
        lifecycle.completeProvisioning(accountId, result.value(), displayToken, password);
    if (completed.isEmpty()) {
      passwordTokenStore.discard(displayToken);
    }
  }

  private ProviderResult<ProvisionedMailbox> createRemote(
      EmailProvider provider, CreateMailboxRequest request) {
    try {
      return provider.createEmailAccount(request);
    } catch (RuntimeException e) {
      log.error("Provider {} threw while creating {}", provider.providerId(), request, e);
      return ProviderResult.failure(
          ProviderErrorKind.REMOTE_REJECTED, "Unexpected provider error: " + e.getMessage());
    }
  }

  /**
   * Deletes a mailbox at its provider after the local row is gone. Failures are logged and
   * dropped; local deletion never waits on this.
   */
  public void deleteRemote(DeleteRemoteMailboxJob job) {
    if (job.emailAddress() == null
        || job.emailAddress().isBlank()
        || job.provider() == null
        || job.provider().isBlank()) {
      log.warn("Ignoring remote delete job without address or provider: {}", job);
      return;
    }
    var provider = providerRegistry.find(job.provider());
    if (provider.isEmpty()) {
      log.error(
          "Cannot delete remote mailbox {}: provider {} is not registered",
          job.emailAddress(),
          job.provider());
      return;
    }
    if (!provider.get().isUsable()) {
      log.error(
          "Cannot delete remote mailbox {}: provider {} is not enabled and set up",
          job.emailAddress(),
          job.provider());
      return;
    }

    ProviderResult<Void> result;
    try {
      result = provider.get().deleteEmailAccount(job.emailAddress());
    } catch (RuntimeException e) {
      log.error("Provider {} threw deleting {}", job.provider(), job.emailAddress(), e);
      return;
    }
    if (result.isSuccess()) {
      log.info("Remote mailbox {} deleted at {}", job.emailAddress(), job.provider());
    } else {
      log.error(
          "Remote delete of {} at {} failed [{}]: {}",
          job.emailAddress(),
          job.provider(),
          result.error().code(),
          result.error().message());
    }
  }

  /** Applies a password change staged by {@link EmailAccountService#changePassword}. */
  public void changePassword(ChangeMailboxPasswordJob job) {
    var accountId = job.accountId();
    var found = emailAccountRepository.findById(accountId);
    if (found.isEmpty()) {
      log.error("Cannot change password for email account {}: not found", accountId);
      passwordTokenStore.claim(accountId);
      return;
    }
    var account = found.get();
    if (!account.isActive()) {
      log.warn(
          "Email account {} is {}; dropping password change", accountId, account.getStatus());
      passwordTokenStore.claim(accountId);
      return;
    }
    var provider = providerRegistry.find(account.getProvider()).filter(EmailProvider::isUsable);
    if (provider.isEmpty()) {
      log.error(
          "Cannot change password for {}: provider {} is unavailable",
          account.getEmailAddress(),
          account.getProvider());
      passwordTokenStore.claim(accountId);
      return;
    }
    var password = passwordTokenStore.claim(accountId);
    if (password.isEmpty()) {
      log.error("Password change for {} expired before it ran", account.getEmailAddress());
      return;
    }

    var result = provider.get().changePassword(account.getEmailAddress(), password.get());
    if (!result.isSuccess()) {
      log.error(
          "Password change for {} failed [{}]: {}",
          account.getEmailAddress(),
          result.error().code(),
          result.error().message());
      return;
    }

    if (account.getPasswordDisplayToken() != null) {
      passwordTokenStore.discard(account.getPasswordDisplayToken());
    }
    var displayToken = passwordTokenStore.store(accountId, password.get());
    lifecycle.replacePasswordDisplayToken(accountId, displayToken);
    log.info("Password changed for {}", account.getEmailAddress());
  }
}
