package io.b2mash.b2b.mailprovisioning.emailaccount;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Mailbox lifecycle. Valid transitions:
 *
 * <ul>
 *   <li>PENDING → PROVISIONING (job picked the account up)
 *   <li>PENDING → FAILED (adapter missing or not set up)
 *   <li>PROVISIONING → ACTIVE / FAILED (remote create outcome)
 *   <li>ACTIVE ⇄ SUSPENDED
 *   <li>FAILED → PENDING (manual re-enqueue only)
 * </ul>
 *
 * <p>Deletion is not a status: the row is removed from any state except PROVISIONING.
 */
public enum EmailAccountStatus {
  PENDING,
  PROVISIONING,
  ACTIVE,
  SUSPENDED,
  FAILED;

  private static final Map<EmailAccountStatus, Set<EmailAccountStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, EnumSet.of(PROVISIONING, FAILED),
          PROVISIONING, EnumSet.of(ACTIVE, FAILED),
          ACTIVE, EnumSet.of(SUSPENDED),
          SUSPENDED, EnumSet.of(ACTIVE),
          FAILED, EnumSet.of(PENDING));

  /** Statuses that count against a membership's email-account limit. */
  public static final Set<EmailAccountStatus> COUNTED_AGAINST_QUOTA =
      EnumSet.of(PENDING, PROVISIONING, ACTIVE, SUSPENDED);

  public boolean canTransitionTo(EmailAccountStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  public boolean countsAgainstQuota() {
    return COUNTED_AGAINST_QUOTA.contains(this);
  }
}
