package com.codeheadsystems.keymanager.server.model;

import com.codeheadsystems.keymanager.crypto.model.PreKeyPair;

/**
 * A one-time pre-key taken from the pool. The caller owns the private key and should
 * {@link PreKeyPair#destroy()} it once the handshake is done.
 *
 * @param keyId   id of the consumed key
 * @param keyPair the decrypted key pair
 */
public record ConsumedPreKey(int keyId, PreKeyPair keyPair) {
}
