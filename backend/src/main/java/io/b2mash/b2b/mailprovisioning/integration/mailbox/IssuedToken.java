package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import java.time.Duration;

/** An OAuth access token and the lifetime the issuer granted it. */
public record IssuedToken(String accessToken, Duration expiresIn) {

  static final Duration DEFAULT_LIFETIME = Duration.ofHours(1);

  /** Builds a token from the {@code expires_in} seconds of a token response (0 when absent). */
  public static IssuedToken of(String accessToken, long expiresInSeconds) {
    return new IssuedToken(
        accessToken,
        expiresInSeconds > 0 ? Duration.ofSeconds(expiresInSeconds) : DEFAULT_LIFETIME);
  }

  @Override
  public String toString() {
    return "IssuedToken[expiresIn=" + expiresIn + "]";
  }
}
