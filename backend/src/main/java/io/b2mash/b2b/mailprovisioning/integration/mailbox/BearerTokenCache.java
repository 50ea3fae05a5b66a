package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide cache of provider bearer tokens. Each entry lives for the issuer's {@code
 * expires_in} minus a 60-second safety margin, so a token is never handed out just before it
 * lapses. Keys are scoped by provider (e.g. {@code microsoft365:<tenant>}).
 *
 * <p>Refresh is not serialized: two threads that miss at the same time both fetch and the last
 * write wins. Tokens are interchangeable, so either is fine to use.
 */
@Component
public class BearerTokenCache {

  static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

  private final Cache<String, IssuedToken> tokens;

  @Autowired
  public BearerTokenCache() {
    this(Ticker.systemTicker());
  }

  BearerTokenCache(Ticker ticker) {
    this.tokens =
        Caffeine.newBuilder()
            .maximumSize(100)
            .expireAfter(
                new Expiry<String, IssuedToken>() {
                  @Override
                  public long expireAfterCreate(String key, IssuedToken token, long currentTime) {
                    return cacheLifetime(token).toNanos();
                  }

                  @Override
                  public long expireAfterUpdate(
                      String key, IssuedToken token, long currentTime, long currentDuration) {
                    return cacheLifetime(token).toNanos();
                  }

                  @Override
                  public long expireAfterRead(
                      String key, IssuedToken token, long currentTime, long currentDuration) {
                    return currentDuration;
                  }
                })
            .ticker(ticker)
            .build();
  }

  /**
   * Returns the cached access token for {@code key}, calling {@code issuer} on a miss. A failed
   * issue is returned as-is and nothing is cached.
   */
  public ProviderResult<String> getOrFetch(
      String key, Supplier<ProviderResult<IssuedToken>> issuer) {
    var cached = tokens.getIfPresent(key);
    if (cached != null) {
      return ProviderResult.success(cached.accessToken());
    }
    var issued = issuer.get();
    if (!issued.isSuccess()) {
      return ProviderResult.failure(issued.error());
    }
    tokens.put(key, issued.value());
    return ProviderResult.success(issued.value().accessToken());
  }

  /** Drops a token the provider has rejected so the next call re-authenticates. */
  public void evict(String key) {
    tokens.invalidate(key);
  }

  static Duration cacheLifetime(IssuedToken token) {
    var lifetime = token.expiresIn().minus(EXPIRY_MARGIN);
    return lifetime.isNegative() ? Duration.ZERO : lifetime;
  }
}
