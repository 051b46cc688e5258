package com.codeheadsystems.keymanager.crypto.model;

import com.codeheadsystems.keymanager.crypto.ByteUtils;

/**
 * Private half of a signed or one-time pre-key. Cannot be used to sign.
 *
 * @param bytes fixed-length big-endian scalar
 */
public record PreKeyPrivateKey(byte[] bytes) {

  /**
   * Overwrites the key bytes in place.
   */
  public void destroy() {
    ByteUtils.zeroize(bytes);
  }

  @Override
  public String toString() {
    return "PreKeyPrivateKey[<redacted>]";
  }
}
