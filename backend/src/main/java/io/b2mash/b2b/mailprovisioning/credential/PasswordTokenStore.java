package io.b2mash.b2b.mailprovisioning.credential;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Short-lived, encrypted password handoff. Nothing here is persisted and plaintext never sits in
 * memory longer than a single call.
 *
 * <ul>
 *   <li>Display tokens: {@link #store} seals a password under a random 32-byte token bound to an
 *       account; {@link #consume} returns it once, and only to a caller presenting the same account
 *       id.
 *   <li>Provisioning handoff: {@link #stash} / {@link #claim} pass a password from the request that
 *       created an account to the async job that provisions it, keyed by account id.
 * </ul>
 *
 * Both expire after {@code mailprovisioning.credentials.token-ttl} (600 s by default), and only
 * then: the caches have no size bound, so the TTL alone limits how much they hold.
 */
@Component
public class PasswordTokenStore {

  private static final Logger log = LoggerFactory.getLogger(PasswordTokenStore.class);

  private static final int TOKEN_BYTES = 32;

  private final PasswordCipher cipher;
  private final Cache<String, SealedPassword> displayTokens;
  private final Cache<UUID, String> handoff;
  private final SecureRandom secureRandom = new SecureRandom();

  @Autowired
  public PasswordTokenStore(PasswordCipher cipher, CredentialProperties properties) {
    this(cipher, properties.tokenTtl(), Ticker.systemTicker());
  }

  PasswordTokenStore(PasswordCipher cipher, Duration ttl, Ticker ticker) {
    this.cipher = cipher;
    // No size bound: an entry may only leave early through consume, claim or discard
    this.displayTokens = Caffeine.newBuilder().expireAfterWrite(ttl).ticker(ticker).build();
    this.handoff = Caffeine.newBuilder().expireAfterWrite(ttl).ticker(ticker).build();
    if (!cipher.isAuthenticated()) {
      log.warn("Password token store is using an unauthenticated cipher");
    }
  }

  /** Seals {@code password} for one later read by {@code accountId}; returns the token. */
  public String store(UUID accountId, String password) {
    var token = newToken();
    displayTokens.put(token, new SealedPassword(accountId, cipher.seal(password)));
    return token;
  }

  /**
   * Returns the password behind {@code token} and deletes it. A token presented with the wrong
   * account id yields empty and stays readable for the right one.
   */
  public Optional<String> consume(String token, UUID accountId) {
    if (token == null || accountId == null) {
      return Optional.empty();
    }
    var entries = displayTokens.asMap();
    var entry = entries.get(token);
    if (entry == null) {
      return Optional.empty();
    }
    if (!entry.accountId().equals(accountId)) {
      log.warn("Password token presented for the wrong email account {}", accountId);
      return Optional.empty();
    }
    // Conditional remove so two concurrent readers cannot both get the password
    if (!entries.remove(token, entry)) {
      return Optional.empty();
    }
    return Optional.of(cipher.open(entry.sealed()));
  }

  /** Drops a display token without reading it. */
  public void discard(String token) {
    if (token != null) {
      displayTokens.invalidate(token);
    }
  }

  /** Holds {@code password} for the provisioning job of {@code accountId}. */
  public void stash(UUID accountId, String password) {
    handoff.put(accountId, cipher.seal(password));
  }

  /** Takes the stashed password for {@code accountId}; empty if expired or already claimed. */
  public Optional<String> claim(UUID accountId) {
    var sealed = handoff.asMap().remove(accountId);
    return Optional.ofNullable(sealed).map(cipher::open);
  }

  private String newToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private record SealedPassword(UUID accountId, String sealed) {

    @Override
    public String toString() {
      return "SealedPassword[accountId=" + accountId + "]";
    }
  }
}
