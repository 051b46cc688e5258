package com.codeheadsystems.keymanager.server.model;

import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;

/**
 * Public half of a signed pre-key with its identity signature.
 *
 * @param keyId     the key id
 * @param publicKey the public key
 * @param signature 64-byte r||s signature over the public key bytes
 */
public record SignedPreKeyPublic(int keyId, PreKeyPublicKey publicKey, byte[] signature) {
}
