package com.codeheadsystems.keymanager.crypto.model;

/**
 * An account's identity key pair.
 *
 * @param publicKey  the public key
 * @param privateKey the private key
 */
public record IdentityKeyPair(IdentityPublicKey publicKey, IdentityPrivateKey privateKey) {

  /**
   * Tags a freshly generated pair as an identity key.
   *
   * @param keyPair the generated pair
   * @return the identity key pair
   */
  public static IdentityKeyPair from(EcKeyPair keyPair) {
    return new IdentityKeyPair(
        new IdentityPublicKey(keyPair.publicKey()),
        new IdentityPrivateKey(keyPair.privateKey()));
  }

  /**
   * Zeroizes the private half.
   */
  public void destroy() {
    privateKey.destroy();
  }
}
