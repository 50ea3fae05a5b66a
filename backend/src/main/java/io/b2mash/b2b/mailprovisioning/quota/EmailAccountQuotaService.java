package io.b2mash.b2b.mailprovisioning.quota;

import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountProperties;
import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountRepository;
import io.b2mash.b2b.mailprovisioning.emailaccount.EmailAccountStatus;
import io.b2mash.b2b.mailprovisioning.platform.MembershipLimitations;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admission control for membership-included email accounts. Denies when the feature is off, when
 * the membership has no enabled email-accounts limitation, or when the customer is at the limit.
 * Only accounts in {@link EmailAccountStatus#COUNTED_AGAINST_QUOTA} are counted.
 */
@Service
public class EmailAccountQuotaService {

  private static final Logger log = LoggerFactory.getLogger(EmailAccountQuotaService.class);

  private final EmailAccountRepository emailAccountRepository;
  private final MembershipLimitations membershipLimitations;
  private final EmailAccountProperties properties;

  public EmailAccountQuotaService(
      EmailAccountRepository emailAccountRepository,
      MembershipLimitations membershipLimitations,
      EmailAccountProperties properties) {
    this.emailAccountRepository = emailAccountRepository;
    this.membershipLimitations = membershipLimitations;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public boolean canCreateAccount(UUID customerId, UUID membershipId) {
    if (!properties.enabled() || membershipId == null) {
      return false;
    }
    var limitation = membershipLimitations.emailAccountLimitation(membershipId);
    if (limitation.isEmpty() || !limitation.get().enabled()) {
      log.debug("Membership {} has no enabled email account limitation", membershipId);
      return false;
    }
    return check(countAccounts(customerId, membershipId), limitation.get());
  }

  @Transactional(readOnly = true)
  public RemainingSlots remainingSlots(UUID customerId, UUID membershipId) {
    if (!properties.enabled() || membershipId == null) {
      return RemainingSlots.of(0);
    }
    var limitation = membershipLimitations.emailAccountLimitation(membershipId);
    if (limitation.isEmpty() || !limitation.get().enabled()) {
      return RemainingSlots.of(0);
    }
    return limitation.get().limit().remaining(countAccounts(customerId, membershipId));
  }

  /** Counted accounts of the customer, scoped to {@code membershipId} when it is not null. */
  @Transactional(readOnly = true)
  public long countAccounts(UUID customerId, UUID membershipId) {
    if (membershipId == null) {
      return emailAccountRepository.countByCustomerIdAndStatusIn(
          customerId, EmailAccountStatus.COUNTED_AGAINST_QUOTA);
    }
    return emailAccountRepository.countByCustomerIdAndMembershipIdAndStatusIn(
        customerId, membershipId, EmailAccountStatus.COUNTED_AGAINST_QUOTA);
  }

  /** Pure admission rule: allowed while {@code count} is strictly below the limit. */
  public static boolean check(long count, EmailAccountLimitation limitation) {
    return limitation != null && limitation.enabled() && limitation.limit().allows(count);
  }
}
