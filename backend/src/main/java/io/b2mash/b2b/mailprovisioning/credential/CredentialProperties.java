package io.b2mash.b2b.mailprovisioning.credential;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code siteSecret} is the site-wide secret the password encryption key is derived from; {@code
 * tokenTtl} bounds how long a one-time password token stays readable.
 */
@ConfigurationProperties("mailprovisioning.credentials")
public record CredentialProperties(String siteSecret, Duration tokenTtl) {

  static final Duration DEFAULT_TOKEN_TTL = Duration.ofSeconds(600);

  public CredentialProperties {
    if (tokenTtl == null || tokenTtl.isNegative() || tokenTtl.isZero()) {
      tokenTtl = DEFAULT_TOKEN_TTL;
    }
  }

  @Override
  public String toString() {
    return "CredentialProperties[tokenTtl=" + tokenTtl + ", siteSecret=***]";
  }
}
