package com.codeheadsystems.keymanager.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model of an account's public key bundle, everything a counterpart needs to start an X3DH
 * handshake while the account is offline.
 * <p>
 * All fields are public key material and safe to send over an untrusted channel. A bundle is
 * only ever published complete: identity key and signed pre-key are always present, the
 * one-time pre-key list may be empty once the pool is exhausted.
 * <p>
 * Used by: {@code GET /keys/{accountId}/bundle}
 *
 * @param identityKeyBase64 base64-encoded identity public key (compressed SEC1 point)
 * @param registrationId    the account's registration id
 * @param signedPreKey      the active signed pre-key
 * @param oneTimePreKeys    a capped batch of unused one-time pre-keys
 */
public record PublishedKeyBundle(
    @JsonProperty("identityKey") String identityKeyBase64,
    @JsonProperty("registrationId") int registrationId,
    @JsonProperty("signedPreKey") PublishedSignedPreKey signedPreKey,
    @JsonProperty("oneTimePreKeys") List<PublishedOneTimePreKey> oneTimePreKeys) {

  public PublishedKeyBundle {
    oneTimePreKeys = oneTimePreKeys == null ? List.of() : List.copyOf(oneTimePreKeys);
  }

  public PublishedKeyBundle(byte[] identityKey,
                            int registrationId,
                            PublishedSignedPreKey signedPreKey,
                            List<PublishedOneTimePreKey> oneTimePreKeys) {
    this(Base64Fields.encode(identityKey), registrationId, signedPreKey, oneTimePreKeys);
  }

  public byte[] identityKey() {
    return Base64Fields.decode(identityKeyBase64, "identityKey");
  }
}
