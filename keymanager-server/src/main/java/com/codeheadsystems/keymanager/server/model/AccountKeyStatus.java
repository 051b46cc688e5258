package com.codeheadsystems.keymanager.server.model;

import com.codeheadsystems.keymanager.model.KeyStatusResponse;
import java.time.Instant;

/**
 * Health of one account's key material.
 *
 * @param accountId            the account
 * @param state                lifecycle state
 * @param unusedPreKeys        unused one-time pre-keys
 * @param poolHealth           pool health against the low-water mark
 * @param activeSignedPreKeyId active signed pre-key id, -1 if none
 * @param signedPreKeyState    rotation state of the active signed pre-key
 * @param nextRotationAt       rotation deadline, null if no active key
 */
public record AccountKeyStatus(
    String accountId,
    AccountState state,
    int unusedPreKeys,
    PoolHealth poolHealth,
    int activeSignedPreKeyId,
    SignedPreKeyFreshness signedPreKeyState,
    Instant nextRotationAt) {

  public KeyStatusResponse toResponse() {
    return new KeyStatusResponse(
        accountId,
        state.name(),
        unusedPreKeys,
        poolHealth.name(),
        activeSignedPreKeyId,
        signedPreKeyState.name(),
        nextRotationAt == null ? null : nextRotationAt.toString());
  }
}
