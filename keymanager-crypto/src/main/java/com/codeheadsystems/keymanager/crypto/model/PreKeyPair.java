package com.codeheadsystems.keymanager.crypto.model;

/**
 * A signed or one-time pre-key pair.
 *
 * @param publicKey  the public key
 * @param privateKey the private key
 */
public record PreKeyPair(PreKeyPublicKey publicKey, PreKeyPrivateKey privateKey) {

  /**
   * Tags a freshly generated pair as a pre-key.
   *
   * @param keyPair the generated pair
   * @return the pre-key pair
   */
  public static PreKeyPair from(EcKeyPair keyPair) {
    return new PreKeyPair(
        new PreKeyPublicKey(keyPair.publicKey()),
        new PreKeyPrivateKey(keyPair.privateKey()));
  }

  /**
   * Zeroizes the private half.
   */
  public void destroy() {
    privateKey.destroy();
  }
}
