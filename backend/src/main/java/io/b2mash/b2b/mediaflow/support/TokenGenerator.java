package io.b2mash.b2b.mediaflow.support;

import java.security.SecureRandom;

/**
 * Random identifiers over the URL-safe alphabet {@code A-Za-z0-9_-}. Used for public job ids,
 * folder tokens and delivery tokens.
 */
public final class TokenGenerator {

  public static final int PUBLIC_JOB_ID_LENGTH = 8;
  public static final int FOLDER_TOKEN_LENGTH = 16;
  public static final int DELIVERY_TOKEN_LENGTH = 32;

  private static final char[] ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_-".toCharArray();

  private static final SecureRandom RANDOM = new SecureRandom();

  private TokenGenerator() {}

  public static String generate(int length) {
    var chars = new char[length];
    for (int i = 0; i < length; i++) {
      chars[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
    }
    return new String(chars);
  }
}
