package com.codeheadsystems.keymanager.client.model;

import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;
import java.util.List;

/**
 * A key bundle whose keys decoded as P-256 points and whose signed pre-key verified under the
 * identity key. Safe to start an X3DH handshake against.
 *
 * @param identityKey    identity public key
 * @param registrationId registration id
 * @param signedPreKeyId id of the signed pre-key
 * @param signedPreKey   signed pre-key
 * @param oneTimePreKeys one-time pre-keys offered by the server, possibly empty
 */
public record VerifiedKeyBundle(
    IdentityPublicKey identityKey,
    int registrationId,
    int signedPreKeyId,
    PreKeyPublicKey signedPreKey,
    List<OneTimePreKey> oneTimePreKeys) {

  public VerifiedKeyBundle {
    oneTimePreKeys = List.copyOf(oneTimePreKeys);
  }

  /**
   * One offered one-time pre-key.
   *
   * @param keyId     the id to name in the handshake
   * @param publicKey the public key
   */
  public record OneTimePreKey(int keyId, PreKeyPublicKey publicKey) {
  }
}
