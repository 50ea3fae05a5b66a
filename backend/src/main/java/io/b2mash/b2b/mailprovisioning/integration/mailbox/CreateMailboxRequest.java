package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for creating a mailbox. {@code quotaMb} of 0 means unlimited (provider-defined);
 * {@code displayName} is optional.
 */
public record CreateMailboxRequest(
    String username, String domain, String password, int quotaMb, String displayName) {

  public String emailAddress() {
    return username + "@" + domain;
  }

  /** Names of the required parameters that are blank. */
  public List<String> missingParams() {
    var missing = new ArrayList<String>();
    if (username == null || username.isBlank()) {
      missing.add("username");
    }
    if (domain == null || domain.isBlank()) {
      missing.add("domain");
    }
    if (password == null || password.isBlank()) {
      missing.add("password");
    }
    return missing;
  }

  public String displayNameOr(String fallback) {
    return displayName == null || displayName.isBlank() ? fallback : displayName;
  }

  @Override
  public String toString() {
    return "CreateMailboxRequest[emailAddress="
        + emailAddress()
        + ", quotaMb="
        + quotaMb
        + ", displayName="
        + displayName
        + ", password=***]";
  }
}
