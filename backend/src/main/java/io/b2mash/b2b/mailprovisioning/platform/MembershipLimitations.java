package io.b2mash.b2b.mailprovisioning.platform;

import io.b2mash.b2b.mailprovisioning.quota.EmailAccountLimitation;
import java.util.Optional;
import java.util.UUID;

/** Host platform's limitations subsystem, narrowed to the one question admission control asks. */
public interface MembershipLimitations {

  /** The membership's email-accounts limitation, or empty when it has none. */
  Optional<EmailAccountLimitation> emailAccountLimitation(UUID membershipId);
}
