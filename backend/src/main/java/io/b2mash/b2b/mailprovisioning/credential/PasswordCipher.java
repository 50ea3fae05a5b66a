package io.b2mash.b2b.mailprovisioning.credential;

/** Reversible encryption for passwords held briefly in the token store. */
public interface PasswordCipher {

  String seal(String plaintext);

  /**
   * @throws IllegalStateException if {@code sealed} was not produced by this cipher or was tampered
   *     with
   */
  String open(String sealed);

  /** False for the labelled plain-encoding fallback. */
  boolean isAuthenticated();
}
