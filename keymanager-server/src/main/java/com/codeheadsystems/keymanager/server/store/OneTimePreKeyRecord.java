package com.codeheadsystems.keymanager.server.store;

import java.time.Instant;

/**
 * Persisted one-time pre-key.
 *
 * @param keyId               per-account id, never reissued
 * @param publicKey           compressed SEC1 public key
 * @param encryptedPrivateKey private key sealed by the key encryption unit
 * @param used                set once a handshake consumed the key
 * @param createdAt           creation time
 */
public record OneTimePreKeyRecord(
    int keyId,
    byte[] publicKey,
    byte[] encryptedPrivateKey,
    boolean used,
    Instant createdAt) {

  /**
   * Copy of this record marked consumed.
   *
   * @return the used record
   */
  public OneTimePreKeyRecord markUsed() {
    return new OneTimePreKeyRecord(keyId, publicKey, encryptedPrivateKey, true, createdAt);
  }
}
