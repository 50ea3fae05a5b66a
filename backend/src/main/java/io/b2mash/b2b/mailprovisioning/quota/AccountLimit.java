package io.b2mash.b2b.mailprovisioning.quota;

import java.util.Locale;

/**
 * A limitation's email-account limit. Three-valued rather than numeric: {@code true} or {@code 0}
 * means unlimited, {@code false} means none allowed, and {@code N > 0} allows up to N accounts.
 */
public final class AccountLimit {

  private static final AccountLimit UNLIMITED = new AccountLimit(Kind.UNLIMITED, 0);
  private static final AccountLimit NONE = new AccountLimit(Kind.NONE, 0);

  private enum Kind {
    UNLIMITED,
    NONE,
    AT_MOST
  }

  private final Kind kind;
  private final long max;

  private AccountLimit(Kind kind, long max) {
    this.kind = kind;
    this.max = max;
  }

  public static AccountLimit unlimited() {
    return UNLIMITED;
  }

  public static AccountLimit none() {
    return NONE;
  }

  /** {@code 0} is unlimited, matching how the limitations subsystem stores it. */
  public static AccountLimit atMost(long max) {
    if (max < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + max);
    }
    return max == 0 ? UNLIMITED : new AccountLimit(Kind.AT_MOST, max);
  }

  /**
   * Reads a raw limit value as stored by the limitations subsystem: {@link Boolean}, {@link
   * Number}, or their string forms. {@code null} reads as none.
   *
   * @throws IllegalArgumentException for anything else
   */
  public static AccountLimit parse(Object raw) {
    if (raw == null) {
      return NONE;
    }
    if (raw instanceof Boolean allowed) {
      return allowed ? UNLIMITED : NONE;
    }
    if (raw instanceof Number number) {
      return atMost(number.longValue());
    }
    var text = raw.toString().trim().toLowerCase(Locale.ROOT);
    if (text.equals("true") || text.equals("unlimited")) {
      return UNLIMITED;
    }
    if (text.equals("false") || text.isEmpty()) {
      return NONE;
    }
    try {
      return atMost(Long.parseLong(text));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unrecognized email account limit: " + raw, e);
    }
  }

  /** Whether one more account may be created when {@code currentCount} already exist. */
  public boolean allows(long currentCount) {
    return switch (kind) {
      case UNLIMITED -> true;
      case NONE -> false;
      case AT_MOST -> currentCount < max;
    };
  }

  public RemainingSlots remaining(long currentCount) {
    return switch (kind) {
      case UNLIMITED -> RemainingSlots.unlimited();
      case NONE -> RemainingSlots.of(0);
      case AT_MOST -> RemainingSlots.of(Math.max(0, max - currentCount));
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AccountLimit other)) {
      return false;
    }
    return kind == other.kind && max == other.max;
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + Long.hashCode(max);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case UNLIMITED -> "unlimited";
      case NONE -> "none";
      case AT_MOST -> String.valueOf(max);
    };
  }
}
