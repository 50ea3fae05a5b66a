package io.b2mash.b2b.mailprovisioning.integration;

import io.b2mash.b2b.mailprovisioning.integration.mailbox.EmailProvider;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Maps provider ids to adapter factories. Populated by explicit {@link #register} calls at startup
 * (see {@link EmailProviderConfig}); each factory runs at most once and its instance is reused.
 */
public class EmailProviderRegistry {

  private final Map<String, Supplier<? extends EmailProvider>> factories =
      new ConcurrentHashMap<>();
  private final List<String> registrationOrder = new CopyOnWriteArrayList<>();
  private final Map<String, EmailProvider> instances = new ConcurrentHashMap<>();

  /**
   * Registers a factory under {@code providerId}. Fails fast if the id is already taken.
   *
   * @throws IllegalStateException on a duplicate registration
   */
  public void register(String providerId, Supplier<? extends EmailProvider> factory) {
    if (providerId == null || providerId.isBlank()) {
      throw new IllegalArgumentException("providerId is required");
    }
    var existing = factories.putIfAbsent(providerId, factory);
    if (existing != null) {
      throw new IllegalStateException("Duplicate email provider registration: " + providerId);
    }
    registrationOrder.add(providerId);
  }

  /** Returns the adapter for {@code providerId}, or empty when nothing is registered under it. */
  public Optional<EmailProvider> find(String providerId) {
    if (providerId == null) {
      return Optional.empty();
    }
    var factory = factories.get(providerId);
    if (factory == null) {
      return Optional.empty();
    }
    return Optional.of(instances.computeIfAbsent(providerId, id -> create(id, factory)));
  }

  /**
   * Resolves an adapter that the caller knows is registered.
   *
   * @throws IllegalArgumentException if no adapter is registered for the id
   */
  public EmailProvider resolve(String providerId) {
    return find(providerId)
        .orElseThrow(
            () -> new IllegalArgumentException("No email provider registered: " + providerId));
  }

  /** Lists registered provider ids in registration order. */
  public List<String> availableProviders() {
    return List.copyOf(registrationOrder);
  }

  /** Adapters that are both enabled and have every required setting. */
  public List<EmailProvider> enabledProviders() {
    return registrationOrder.stream()
        .map(this::resolve)
        .filter(EmailProvider::isUsable)
        .toList();
  }

  private static EmailProvider create(
      String providerId, Supplier<? extends EmailProvider> factory) {
    var provider = factory.get();
    if (provider == null) {
      throw new IllegalStateException("Factory for " + providerId + " returned null");
    }
    if (!providerId.equals(provider.providerId())) {
      throw new IllegalStateException(
          "Provider registered as "
              + providerId
              + " reports id "
              + provider.providerId()
              + " ("
              + provider.getClass().getName()
              + ")");
    }
    return provider;
  }
}
