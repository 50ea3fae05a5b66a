package io.b2mash.b2b.mailprovisioning.credential;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Plain reversible encoding for JVMs without AES/GCM. Not encryption. Values are labelled with
 * {@code insecure-base64:} so they can never be mistaken for sealed ones.
 */
public class InsecureBase64PasswordCipher implements PasswordCipher {

  static final String PREFIX = "insecure-base64:";

  @Override
  public String seal(String plaintext) {
    return PREFIX
        + Base64.getEncoder().encodeToString(plaintext.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String open(String sealed) {
    if (sealed == null || !sealed.startsWith(PREFIX)) {
      throw new IllegalStateException("Not an insecure-base64 value");
    }
    return new String(
        Base64.getDecoder().decode(sealed.substring(PREFIX.length())), StandardCharsets.UTF_8);
  }

  @Override
  public boolean isAuthenticated() {
    return false;
  }
}
