package io.b2mash.b2b.mailprovisioning.integration;

/** Result of probing a mailbox provider with its configured credentials. */
public record ConnectionTestResult(
    boolean success, String providerId, ProviderErrorKind errorKind, String errorMessage) {

  public static ConnectionTestResult ok(String providerId) {
    return new ConnectionTestResult(true, providerId, null, null);
  }

  public static ConnectionTestResult failed(String providerId, ProviderError error) {
    return new ConnectionTestResult(false, providerId, error.kind(), error.message());
  }

  public static ConnectionTestResult from(String providerId, ProviderResult<?> result) {
    return result.isSuccess() ? ok(providerId) : failed(providerId, result.error());
  }
}
