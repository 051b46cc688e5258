package com.codeheadsystems.keymanager.model;

import java.util.Base64;

/**
 * Base64 helpers shared by the wire records.
 */
final class Base64Fields {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private Base64Fields() {
  }

  static String encode(byte[] value) {
    return value == null ? null : B64.encodeToString(value);
  }

  static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }
}
