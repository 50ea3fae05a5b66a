package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import io.b2mash.b2b.mailprovisioning.integration.ProviderResult;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class BearerTokenCacheTest {

  @Test
  void cachedTokenIsReusedUntilSixtySecondsBeforeExpiry() {
    var ticker = new FakeTicker();
    var cache = new BearerTokenCache(ticker);
    var issued = new AtomicInteger();

    var first =
        cache.getOrFetch(
            "microsoft365:t1",
            () -> ProviderResult.success(IssuedToken.of(next(issued), 3600)));
    ticker.advance(Duration.ofSeconds(3539));
    var second =
        cache.getOrFetch(
            "microsoft365:t1",
            () -> ProviderResult.success(IssuedToken.of(next(issued), 3600)));
    ticker.advance(Duration.ofSeconds(2));
    var third =
        cache.getOrFetch(
            "microsoft365:t1",
            () -> ProviderResult.success(IssuedToken.of(next(issued), 3600)));

    assertThat(first.value()).isEqualTo("token-1");
    assertThat(second.value()).isEqualTo("token-1");
    assertThat(third.value()).isEqualTo("token-2");
  }

  @Test
  void failedIssueIsNotCached() {
    var cache = new BearerTokenCache(new FakeTicker());
    var calls = new AtomicInteger();

    var failed =
        cache.getOrFetch(
            "google_workspace:admin@example.com",
            () -> {
              calls.incrementAndGet();
              return ProviderResult.failure(ProviderErrorKind.INVALID_CREDENTIALS, "bad key");
            });
    var retried =
        cache.getOrFetch(
            "google_workspace:admin@example.com",
            () -> {
              calls.incrementAndGet();
              return ProviderResult.success(IssuedToken.of("ok", 3600));
            });

    assertThat(failed.error().kind()).isEqualTo(ProviderErrorKind.INVALID_CREDENTIALS);
    assertThat(retried.value()).isEqualTo("ok");
    assertThat(calls).hasValue(2);
  }

  @Test
  void evictForcesRefetch() {
    var cache = new BearerTokenCache(new FakeTicker());
    cache.getOrFetch("k", () -> ProviderResult.success(IssuedToken.of("old", 3600)));

    cache.evict("k");

    var refreshed =
        cache.getOrFetch("k", () -> ProviderResult.success(IssuedToken.of("new", 3600)));
    assertThat(refreshed.value()).isEqualTo("new");
  }

  @Test
  void keysAreIndependent() {
    var cache = new BearerTokenCache(new FakeTicker());
    cache.getOrFetch("microsoft365:a", () -> ProviderResult.success(IssuedToken.of("a", 3600)));

    var other =
        cache.getOrFetch("microsoft365:b", () -> ProviderResult.success(IssuedToken.of("b", 3600)));

    assertThat(other.value()).isEqualTo("b");
  }

  @Test
  void cacheLifetimeNeverGoesNegative() {
    assertThat(BearerTokenCache.cacheLifetime(IssuedToken.of("t", 30))).isEqualTo(Duration.ZERO);
    assertThat(BearerTokenCache.cacheLifetime(IssuedToken.of("t", 0)))
        .isEqualTo(Duration.ofSeconds(3540));
  }

  private static String next(AtomicInteger issued) {
    return "token-" + issued.incrementAndGet();
  }

  private static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong(System.nanoTime());

    void advance(Duration delta) {
      nanos.addAndGet(delta.toNanos());
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
