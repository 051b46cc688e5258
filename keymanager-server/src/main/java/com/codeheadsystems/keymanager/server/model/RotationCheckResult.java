package com.codeheadsystems.keymanager.server.model;

/**
 * Outcome of one maintenance pass over an account.
 *
 * @param signedPreKeyRotated     whether a new signed pre-key was installed
 * @param preKeysGenerated        one-time pre-keys added to the pool
 * @param unusedPreKeys           unused pool size after the pass
 * @param prunedSignedPreKeys     superseded signed pre-keys deleted after their grace period
 */
public record RotationCheckResult(
    boolean signedPreKeyRotated,
    int preKeysGenerated,
    int unusedPreKeys,
    int prunedSignedPreKeys) {
}
