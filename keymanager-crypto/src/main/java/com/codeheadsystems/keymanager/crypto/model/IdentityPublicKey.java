package com.codeheadsystems.keymanager.crypto.model;

import java.util.Arrays;

/**
 * Public half of an account's long-term identity key. The only key type accepted for verifying
 * signed pre-key signatures.
 *
 * @param bytes compressed SEC1 encoding
 */
public record IdentityPublicKey(byte[] bytes) {

  @Override
  public boolean equals(Object o) {
    return o instanceof IdentityPublicKey other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "IdentityPublicKey[" + bytes.length + " bytes]";
  }
}
