package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.exception.InvalidStateException;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.MailboxAddress;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * One mailbox across its lifecycle. Status only changes through {@link
 * EmailAccountLifecycle}, which guards transitions via {@link #transitionTo} and publishes the
 * matching lifecycle event.
 */
@Entity
@Table(name = "email_accounts")
public class EmailAccount {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email_address", nullable = false, unique = true, length = 320)
  private String emailAddress;

  @Column(name = "domain", nullable = false)
  private String domain;

  @Column(name = "customer_id", nullable = false)
  private UUID customerId;

  @Column(name = "membership_id")
  private UUID membershipId;

  @Column(name = "site_id")
  private UUID siteId;

  @Column(name = "provider", nullable = false, length = 50)
  private String provider;

  @Column(name = "external_id")
  private String externalId;

  @Column(name = "display_name")
  private String displayName;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EmailAccountStatus status;

  @Column(name = "quota_mb", nullable = false)
  private int quotaMb;

  @Enumerated(EnumType.STRING)
  @Column(name = "purchase_type", nullable = false, length = 30)
  private PurchaseType purchaseType;

  @Column(name = "payment_id")
  private UUID paymentId;

  @Column(name = "password_display_token", length = 64)
  private String passwordDisplayToken;

  /** Set once the account first enters PROVISIONING; never cleared, not even by a re-queue. */
  @Column(name = "remote_create_attempted", nullable = false)
  private boolean remoteCreateAttempted;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "date_created", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "date_modified", nullable = false)
  private Instant updatedAt;

  protected EmailAccount() {}

  public EmailAccount(
      MailboxAddress address,
      UUID customerId,
      UUID membershipId,
      UUID siteId,
      String provider,
      int quotaMb,
      PurchaseType purchaseType) {
    this.emailAddress = address.emailAddress();
    this.domain = address.domain();
    this.customerId = customerId;
    this.membershipId = membershipId;
    this.siteId = siteId;
    this.provider = provider;
    this.quotaMb = quotaMb;
    this.purchaseType = purchaseType;
    this.status = EmailAccountStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Moves to {@code target} if the lifecycle allows it.
   *
   * @throws InvalidStateException on an illegal edge
   */
  void transitionTo(EmailAccountStatus target) {
    if (!status.canTransitionTo(target)) {
      throw InvalidStateException.transition(status, target);
    }
    this.status = target;
    if (target == EmailAccountStatus.PROVISIONING) {
      this.remoteCreateAttempted = true;
    }
    this.updatedAt = Instant.now();
  }

  void recordProvisioned(String externalId, int quotaMb) {
    if (externalId != null && !externalId.isBlank()) {
      this.externalId = externalId;
    }
    this.quotaMb = quotaMb;
    this.updatedAt = Instant.now();
  }

  void setPasswordDisplayToken(String passwordDisplayToken) {
    this.passwordDisplayToken = passwordDisplayToken;
    this.updatedAt = Instant.now();
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
    this.updatedAt = Instant.now();
  }

  public void setPaymentId(UUID paymentId) {
    this.paymentId = paymentId;
    this.updatedAt = Instant.now();
  }

  public MailboxAddress address() {
    return new MailboxAddress(username(), domain);
  }

  /** Local part of the address. */
  public String username() {
    return emailAddress.substring(0, emailAddress.lastIndexOf('@'));
  }

  public boolean isActive() {
    return status == EmailAccountStatus.ACTIVE;
  }

  /** Whether a provider may hold a mailbox for this account, whatever its current status. */
  public boolean isRemoteCreateAttempted() {
    return remoteCreateAttempted;
  }

  public boolean isPerAccountPurchase() {
    return purchaseType == PurchaseType.PER_ACCOUNT_PURCHASE;
  }

  public UUID getId() {
    return id;
  }

  public String getEmailAddress() {
    return emailAddress;
  }

  public String getDomain() {
    return domain;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public UUID getMembershipId() {
    return membershipId;
  }

  public UUID getSiteId() {
    return siteId;
  }

  public String getProvider() {
    return provider;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public EmailAccountStatus getStatus() {
    return status;
  }

  public int getQuotaMb() {
    return quotaMb;
  }

  public PurchaseType getPurchaseType() {
    return purchaseType;
  }

  public UUID getPaymentId() {
    return paymentId;
  }

  public String getPasswordDisplayToken() {
    return passwordDisplayToken;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
