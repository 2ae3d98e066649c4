package com.codeheadsystems.latchkey.model.lock;

import java.util.Base64;

/**
 * Base64url (no padding) codec for the byte fields of the lock API.
 */
public final class LockValues {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private LockValues() {
  }

  /**
   * Encodes bytes for the wire.
   *
   * @param bytes the bytes
   * @return base64url text without padding
   */
  public static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes a required wire field.
   *
   * @param value the field value
   * @param name  the field name, used in error messages
   * @return the decoded bytes
   * @throws IllegalArgumentException if the field is missing or not base64url
   */
  public static byte[] decode(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
    try {
      return DECODER.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64url in field: " + name, e);
    }
  }
}
