package io.b2mash.b2b.mailprovisioning.platform;

import java.util.UUID;

/** Accepts customers listed in {@code mailprovisioning.platform.customers}, or any when unset. */
public class ConfiguredCustomerDirectory implements CustomerDirectory {

  private final PlatformProperties properties;

  public ConfiguredCustomerDirectory(PlatformProperties properties) {
    this.properties = properties;
  }

  @Override
  public boolean exists(UUID customerId) {
    if (customerId == null) {
      return false;
    }
    return properties.customers().isEmpty() || properties.customers().contains(customerId);
  }
}
