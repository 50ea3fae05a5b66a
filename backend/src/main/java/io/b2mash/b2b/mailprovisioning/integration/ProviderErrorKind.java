package io.b2mash.b2b.mailprovisioning.integration;

/** Normalized failure categories every mailbox provider maps its own error payloads onto. */
public enum ProviderErrorKind {
  /** A required argument (username, domain, password) was blank. */
  MISSING_PARAMS,
  /** The backend refused the configured credentials (HTTP 401/403, bad OAuth client). */
  INVALID_CREDENTIALS,
  /** The adapter is disabled or lacks required settings. */
  NOT_CONFIGURED,
  /** Network failure or timeout before a response arrived. */
  REMOTE_UNREACHABLE,
  /** Any other 4xx/5xx, carrying the provider's message. */
  REMOTE_REJECTED,
  ALREADY_EXISTS,
  NOT_FOUND,
  RATE_LIMITED
}
