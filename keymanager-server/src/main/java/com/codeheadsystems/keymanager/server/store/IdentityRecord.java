package com.codeheadsystems.keymanager.server.store;

import java.time.Instant;

/**
 * Persisted identity of an account.
 *
 * @param identityPublicKey          compressed SEC1 identity public key
 * @param encryptedIdentityPrivateKey identity private key sealed by the key encryption unit
 * @param registrationId             random per-account registration id
 * @param createdAt                  when the identity was generated
 */
public record IdentityRecord(
    byte[] identityPublicKey,
    byte[] encryptedIdentityPrivateKey,
    int registrationId,
    Instant createdAt) {
}
