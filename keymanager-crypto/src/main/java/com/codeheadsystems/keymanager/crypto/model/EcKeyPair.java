package com.codeheadsystems.keymanager.crypto.model;

/**
 * Untyped key pair as it comes out of the generator. Wrap it in {@link IdentityKeyPair} or
 * {@link PreKeyPair} before handing it to anything that cares about the key's role.
 *
 * @param publicKey  compressed SEC1 public point
 * @param privateKey fixed-length big-endian private scalar
 */
public record EcKeyPair(byte[] publicKey, byte[] privateKey) {

  @Override
  public String toString() {
    return "EcKeyPair[publicKey=" + publicKey.length + " bytes, privateKey=<redacted>]";
  }
}
