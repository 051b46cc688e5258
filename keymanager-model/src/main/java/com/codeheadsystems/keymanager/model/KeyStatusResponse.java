package com.codeheadsystems.keymanager.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operational view of one account's key health. Carries no key material.
 * <p>
 * Used by: {@code GET /keys/{accountId}/status}
 *
 * @param accountId            the account
 * @param state                lifecycle state ({@code UNINITIALIZED}, {@code BOOTSTRAPPING}, {@code READY})
 * @param unusedPreKeys        unused one-time pre-keys in the pool
 * @param poolHealth           {@code HEALTHY} or {@code LOW}
 * @param activeSignedPreKeyId id of the active signed pre-key, or -1 if none
 * @param signedPreKeyState    {@code CURRENT} or {@code DUE_FOR_ROTATION}
 * @param nextRotationAt       ISO-8601 rotation deadline of the active signed pre-key, null if none
 */
public record KeyStatusResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("state") String state,
    @JsonProperty("unusedPreKeys") int unusedPreKeys,
    @JsonProperty("poolHealth") String poolHealth,
    @JsonProperty("activeSignedPreKeyId") int activeSignedPreKeyId,
    @JsonProperty("signedPreKeyState") String signedPreKeyState,
    @JsonProperty("nextRotationAt") String nextRotationAt) {
}
