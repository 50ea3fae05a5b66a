package io.b2mash.b2b.mailprovisioning.emailaccount;

import java.util.Locale;
import org.springframework.http.HttpStatus;

/** Why {@link EmailAccountService#createAccount} refused a request. */
public enum RejectionReason {
  FEATURE_DISABLED(HttpStatus.FORBIDDEN, "Email accounts are disabled"),
  INVALID_CUSTOMER(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid customer"),
  INVALID_PROVIDER(HttpStatus.UNPROCESSABLE_ENTITY, "Email provider unavailable"),
  INVALID_EMAIL(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid email address"),
  DOMAIN_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY, "Domain does not match email address"),
  EMAIL_EXISTS(HttpStatus.CONFLICT, "Email address already exists"),
  PURCHASE_NOT_ALLOWED(HttpStatus.FORBIDDEN, "Per-account purchases are disabled"),
  QUOTA_EXCEEDED(HttpStatus.FORBIDDEN, "Email account limit reached");

  private final HttpStatus status;
  private final String title;

  RejectionReason(HttpStatus status, String title) {
    this.status = status;
    this.title = title;
  }

  public HttpStatus status() {
    return status;
  }

  public String title() {
    return title;
  }

  /** Stable lower-case code, e.g. {@code email_exists}. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
