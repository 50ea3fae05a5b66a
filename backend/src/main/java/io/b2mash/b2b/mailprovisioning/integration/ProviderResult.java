package io.b2mash.b2b.mailprovisioning.integration;

import java.util.function.Function;

/**
 * Outcome of a call into a mailbox provider: either a value or a {@link ProviderError}. Adapters
 * never throw for remote failures; they translate them into one of the {@link ProviderErrorKind}
 * categories instead.
 *
 * <p>Use the static factories:
 *
 * <ul>
 *   <li>{@link #success(Object)} / {@link #ok()}: the call succeeded
 *   <li>{@link #failure(ProviderErrorKind, String)}: the call failed
 * </ul>
 */
public final class ProviderResult<T> {

  private final T value;
  private final ProviderError error;

  private ProviderResult(T value, ProviderError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> ProviderResult<T> success(T value) {
    return new ProviderResult<>(value, null);
  }

  /** Success without a payload, for delete and password-change calls. */
  public static ProviderResult<Void> ok() {
    return new ProviderResult<>(null, null);
  }

  public static <T> ProviderResult<T> failure(ProviderErrorKind kind, String message) {
    return new ProviderResult<>(null, new ProviderError(kind, message));
  }

  public static <T> ProviderResult<T> failure(ProviderError error) {
    return new ProviderResult<>(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public T value() {
    if (error != null) {
      throw new IllegalStateException("No value on failed result: " + error.code());
    }
    return value;
  }

  public ProviderError error() {
    if (error == null) {
      throw new IllegalStateException("No error on successful result");
    }
    return error;
  }

  /** Maps the value of a successful result; failures pass through with the same error. */
  public <R> ProviderResult<R> map(Function<? super T, ? extends R> mapper) {
    if (error != null) {
      return failure(error);
    }
    return success(mapper.apply(value));
  }

  /** Chains a second provider call that only runs when this one succeeded. */
  public <R> ProviderResult<R> flatMap(Function<? super T, ProviderResult<R>> next) {
    if (error != null) {
      return failure(error);
    }
    return next.apply(value);
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "ProviderResult[success]"
        : "ProviderResult[" + error.code() + ": " + error.message() + "]";
  }
}
