package io.intellixity.semgate.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 helpers shared by query hashing and identifier scoping. */
public final class Digests {
  private Digests() {}

  public static String sha256Hex(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** First {@code hexChars} lowercase hex characters of the SHA-256 of {@code text}. */
  public static String sha256Prefix(String text, int hexChars) {
    if (hexChars <= 0 || hexChars > 64) throw new IllegalArgumentException("hexChars must be in 1..64");
    return sha256Hex(text).substring(0, hexChars);
  }
}
