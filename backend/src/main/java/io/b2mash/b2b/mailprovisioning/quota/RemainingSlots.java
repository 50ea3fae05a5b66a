package io.b2mash.b2b.mailprovisioning.quota;

import com.fasterxml.jackson.annotation.JsonValue;

/** Accounts still creatable: a non-negative count or the {@code "unlimited"} sentinel. */
public record RemainingSlots(boolean unlimited, long count) {

  public static final String UNLIMITED = "unlimited";

  private static final RemainingSlots UNLIMITED_SLOTS = new RemainingSlots(true, 0);

  public RemainingSlots {
    if (count < 0) {
      throw new IllegalArgumentException("Remaining slots cannot be negative: " + count);
    }
  }

  public static RemainingSlots unlimited() {
    return UNLIMITED_SLOTS;
  }

  public static RemainingSlots of(long count) {
    return new RemainingSlots(false, count);
  }

  /** Serialized as the number, or the string {@code "unlimited"}. */
  @JsonValue
  public Object value() {
    return unlimited ? UNLIMITED : count;
  }

  @Override
  public String toString() {
    return String.valueOf(value());
  }
}
