package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.util.ArrayList;
import java.util.List;

/** Collects the names of required provider settings that are unset or blank. */
final class ProviderSettings {

  private final List<String> missing = new ArrayList<>();

  private ProviderSettings() {}

  static ProviderSettings check() {
    return new ProviderSettings();
  }

  ProviderSettings require(String name, String value) {
    if (isBlank(value)) {
      missing.add(name);
    }
    return this;
  }

  /** At least one of two alternatives must be set; reported as {@code first|second}. */
  ProviderSettings requireEither(
      String first, String firstValue, String second, String secondValue) {
    if (isBlank(firstValue) && isBlank(secondValue)) {
      missing.add(first + "|" + second);
    }
    return this;
  }

  List<String> missing() {
    return List.copyOf(missing);
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
