package com.codeheadsystems.keymanager.server.model;

import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.model.PublishedKeyBundle;
import com.codeheadsystems.keymanager.model.PublishedOneTimePreKey;
import com.codeheadsystems.keymanager.model.PublishedSignedPreKey;
import java.util.List;

/**
 * Public key bundle of an account, ready to publish. Contains no private material.
 *
 * @param identityKey    identity public key
 * @param registrationId registration id
 * @param signedPreKey   active signed pre-key
 * @param oneTimePreKeys unused one-time pre-keys, ascending by id
 */
public record KeyBundle(
    IdentityPublicKey identityKey,
    int registrationId,
    SignedPreKeyPublic signedPreKey,
    List<OneTimePreKeyPublic> oneTimePreKeys) {

  public KeyBundle {
    oneTimePreKeys = List.copyOf(oneTimePreKeys);
  }

  /**
   * Wire form of this bundle.
   *
   * @return the published bundle
   */
  public PublishedKeyBundle toPublished() {
    return new PublishedKeyBundle(
        identityKey.bytes(),
        registrationId,
        new PublishedSignedPreKey(signedPreKey.keyId(), signedPreKey.publicKey().bytes(), signedPreKey.signature()),
        oneTimePreKeys.stream()
            .map(k -> new PublishedOneTimePreKey(k.keyId(), k.publicKey().bytes()))
            .toList());
  }
}
