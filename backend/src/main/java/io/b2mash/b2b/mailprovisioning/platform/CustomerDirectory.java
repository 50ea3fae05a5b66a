package io.b2mash.b2b.mailprovisioning.platform;

import java.util.UUID;

/** Host platform's customer records. */
public interface CustomerDirectory {

  boolean exists(UUID customerId);
}
