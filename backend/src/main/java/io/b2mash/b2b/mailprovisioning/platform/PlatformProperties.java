package io.b2mash.b2b.mailprovisioning.platform;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Standalone stand-ins for host data, used only when no host beans replace the defaults in {@link
 * PlatformConfig}. An empty {@code customers} set accepts every customer id.
 */
@ConfigurationProperties("mailprovisioning.platform")
public record PlatformProperties(Set<UUID> customers, Map<UUID, MembershipLimit> memberships) {

  public PlatformProperties {
    customers = customers == null ? Set.of() : Set.copyOf(customers);
    memberships = memberships == null ? Map.of() : Map.copyOf(memberships);
  }

  /** {@code limit} is raw: {@code true}, {@code false}, or a number where 0 means unlimited. */
  public record MembershipLimit(boolean enabled, String limit) {}
}
