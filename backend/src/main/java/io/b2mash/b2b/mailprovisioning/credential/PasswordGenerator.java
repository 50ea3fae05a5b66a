package io.b2mash.b2b.mailprovisioning.credential;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/**
 * Generates mailbox passwords: 16 characters with at least one lower-case letter, upper-case
 * letter, digit and symbol, which satisfies every supported provider's complexity rules.
 */
@Component
public class PasswordGenerator {

  static final int LENGTH = 16;

  private static final String LOWER = "abcdefghijkmnopqrstuvwxyz";
  private static final String UPPER = "ABCDEFGHJKLMNPQRSTUVWXYZ";
  private static final String DIGITS = "23456789";
  private static final String SYMBOLS = "!@#$%^&*()-_=+";
  private static final String ALL = LOWER + UPPER + DIGITS + SYMBOLS;

  private final SecureRandom random = new SecureRandom();

  public String generate() {
    char[] password = new char[LENGTH];
    password[0] = pick(LOWER);
    password[1] = pick(UPPER);
    password[2] = pick(DIGITS);
    password[3] = pick(SYMBOLS);
    for (int i = 4; i < LENGTH; i++) {
      password[i] = pick(ALL);
    }
    // Fisher-Yates so the guaranteed classes are not always in front
    for (int i = LENGTH - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      char tmp = password[i];
      password[i] = password[j];
      password[j] = tmp;
    }
    return new String(password);
  }

  private char pick(String alphabet) {
    return alphabet.charAt(random.nextInt(alphabet.length()));
  }
}
