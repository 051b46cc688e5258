package com.codeheadsystems.keymanager.crypto.model;

import com.codeheadsystems.keymanager.crypto.ByteUtils;

/**
 * Private half of an account's long-term identity key. The only key type accepted for signing.
 *
 * @param bytes fixed-length big-endian scalar
 */
public record IdentityPrivateKey(byte[] bytes) {

  /**
   * Overwrites the key bytes in place.
   */
  public void destroy() {
    ByteUtils.zeroize(bytes);
  }

  @Override
  public String toString() {
    return "IdentityPrivateKey[<redacted>]";
  }
}
