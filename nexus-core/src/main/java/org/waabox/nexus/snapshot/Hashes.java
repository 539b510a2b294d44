package org.waabox.nexus.snapshot;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing of snapshot payloads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Hashes {

  /** The hex characters used for hash string conversion. */
  private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

  private Hashes() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the SHA-256 of the given bytes.
   *
   * @param data the bytes to hash, never null
   *
   * @return the lowercase hex-encoded hash, never null
   */
  public static String sha256(final byte[] data) {
    return toHexString(digest(data));
  }

  /**
   * Computes the raw SHA-256 of the given bytes.
   *
   * @param data the bytes to hash, never null
   *
   * @return the 32 byte digest, never null
   */
  public static byte[] digest(final byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Converts a byte array to a lowercase hex string.
   *
   * @param bytes the bytes to convert, never null
   *
   * @return the hex string representation, never null
   */
  public static String toHexString(final byte[] bytes) {
    final char[] hexChars = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int v = bytes[i] & 0xFF;
      hexChars[i * 2] = HEX_CHARS[v >>> 4];
      hexChars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
    }
    return new String(hexChars);
  }
}
