package com.codeheadsystems.keymanager.server.store;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted signed pre-key.
 *
 * @param keyId               per-account id, increasing with every rotation
 * @param publicKey           compressed SEC1 public key
 * @param encryptedPrivateKey private key sealed by the key encryption unit
 * @param signature           identity-key signature over {@code publicKey}
 * @param createdAt           creation time
 * @param rotationInterval    lifetime the key was created with
 * @param nextRotationAt      rotation deadline
 * @param active              whether this is the account's active signed pre-key
 * @param deactivatedAt       when a newer key superseded this one, null while active
 */
public record SignedPreKeyRecord(
    int keyId,
    byte[] publicKey,
    byte[] encryptedPrivateKey,
    byte[] signature,
    Instant createdAt,
    Duration rotationInterval,
    Instant nextRotationAt,
    boolean active,
    Instant deactivatedAt) {

  /**
   * Whether the rotation deadline has been reached.
   *
   * @param now the current time
   * @return true if the key should be replaced
   */
  public boolean isDueForRotation(Instant now) {
    return !now.isBefore(nextRotationAt);
  }

  /**
   * Copy of this record marked superseded.
   *
   * @param at deactivation time
   * @return the inactive record
   */
  public SignedPreKeyRecord deactivate(Instant at) {
    return new SignedPreKeyRecord(keyId, publicKey, encryptedPrivateKey, signature, createdAt,
        rotationInterval, nextRotationAt, false, at);
  }
}
