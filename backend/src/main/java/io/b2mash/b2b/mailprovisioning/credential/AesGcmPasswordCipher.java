package io.b2mash.b2b.mailprovisioning.credential;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM with the key derived as SHA-256 of the site secret. Output is {@code v1:} followed by
 * base64 of {@code nonce || ciphertext+tag}.
 */
public class AesGcmPasswordCipher implements PasswordCipher {

  static final String PREFIX = "v1:";

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes

  private final SecretKeySpec key;
  private final SecureRandom secureRandom = new SecureRandom();

  public AesGcmPasswordCipher(String siteSecret) {
    if (siteSecret == null || siteSecret.isBlank()) {
      throw new IllegalStateException(
          "mailprovisioning.credentials.site-secret is not set. "
              + "Cannot start without a secret for password encryption.");
    }
    this.key = new SecretKeySpec(sha256(siteSecret), "AES");
  }

  /** Whether this JVM offers AES/GCM at all. */
  public static boolean isAvailable() {
    try {
      Cipher.getInstance(ALGORITHM);
      return true;
    } catch (GeneralSecurityException e) {
      return false;
    }
  }

  @Override
  public String seal(String plaintext) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      var combined = ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext);
      return PREFIX + Base64.getEncoder().encodeToString(combined.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  @Override
  public String open(String sealed) {
    if (sealed == null || !sealed.startsWith(PREFIX)) {
      throw new IllegalStateException("Not an AES-GCM sealed value");
    }
    byte[] combined;
    try {
      combined = Base64.getDecoder().decode(sealed.substring(PREFIX.length()));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Sealed value is not valid base64", e);
    }
    if (combined.length <= IV_LENGTH) {
      throw new IllegalStateException("Sealed value is truncated");
    }
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, IV_LENGTH));
      byte[] plaintext = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }

  @Override
  public boolean isAuthenticated() {
    return true;
  }

  private static byte[] sha256(String secret) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
