package io.b2mash.b2b.mailprovisioning.emailaccount;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Feature switches for email accounts. {@code enabled} gates the whole feature; {@code
 * perAccountPurchaseEnabled} allows standalone purchases outside a membership's limit.
 */
@ConfigurationProperties("mailprovisioning.email-accounts")
public record EmailAccountProperties(
    boolean enabled, Integer defaultQuotaMb, boolean perAccountPurchaseEnabled) {

  static final int DEFAULT_QUOTA_MB = 1024;

  public EmailAccountProperties {
    if (defaultQuotaMb == null || defaultQuotaMb < 0) {
      defaultQuotaMb = DEFAULT_QUOTA_MB;
    }
  }
}
