package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** A lower-cased {@code local@domain} pair. */
public record MailboxAddress(String localPart, String domain) {

  private static final Pattern LOCAL_PART = Pattern.compile("^[a-z0-9!#$%&'*+/=?^_`{|}~.-]+$");
  private static final Pattern DOMAIN =
      Pattern.compile("^(?=.{1,253}$)([a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

  public MailboxAddress {
    if (localPart == null || localPart.isBlank() || domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("Mailbox address needs both a local part and a domain");
    }
    localPart = localPart.toLowerCase(Locale.ROOT);
    domain = domain.toLowerCase(Locale.ROOT);
  }

  /** Parses {@code raw}, returning empty for anything that is not a syntactically valid address. */
  public static Optional<MailboxAddress> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    var candidate = raw.trim().toLowerCase(Locale.ROOT);
    int at = candidate.lastIndexOf('@');
    if (at <= 0 || at != candidate.indexOf('@') || at == candidate.length() - 1) {
      return Optional.empty();
    }
    var local = candidate.substring(0, at);
    var domain = candidate.substring(at + 1);
    if (local.length() > 64
        || local.startsWith(".")
        || local.endsWith(".")
        || local.contains("..")
        || !LOCAL_PART.matcher(local).matches()
        || !DOMAIN.matcher(domain).matches()) {
      return Optional.empty();
    }
    return Optional.of(new MailboxAddress(local, domain));
  }

  public String emailAddress() {
    return localPart + "@" + domain;
  }

  @Override
  public String toString() {
    return emailAddress();
  }
}
