package io.b2mash.b2b.mailprovisioning.platform;

import io.b2mash.b2b.mailprovisioning.quota.EmailAccountLimitation;
import java.util.Optional;
import java.util.UUID;

/** Reads limitations from {@code mailprovisioning.platform.memberships}. */
public class ConfiguredMembershipLimitations implements MembershipLimitations {

  private final PlatformProperties properties;

  public ConfiguredMembershipLimitations(PlatformProperties properties) {
    this.properties = properties;
  }

  @Override
  public Optional<EmailAccountLimitation> emailAccountLimitation(UUID membershipId) {
    if (membershipId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(properties.memberships().get(membershipId))
        .map(entry -> EmailAccountLimitation.of(entry.enabled(), entry.limit()));
  }
}
