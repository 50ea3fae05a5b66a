package io.b2mash.b2b.mailprovisioning.integration;

import java.util.Locale;

public record ProviderError(ProviderErrorKind kind, String message) {

  public ProviderError {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
  }

  /** Lower-case code used in logs and problem responses, e.g. {@code remote_rejected}. */
  public String code() {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
