package com.codeheadsystems.keymanager.crypto.model;

import java.util.Arrays;

/**
 * Public half of a signed or one-time pre-key.
 *
 * @param bytes compressed SEC1 encoding
 */
public record PreKeyPublicKey(byte[] bytes) {

  @Override
  public boolean equals(Object o) {
    return o instanceof PreKeyPublicKey other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "PreKeyPublicKey[" + bytes.length + " bytes]";
  }
}
