package com.codeheadsystems.keymanager.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model of one unused one-time pre-key inside a published bundle.
 *
 * @param keyId           the one-time pre-key id
 * @param publicKeyBase64 base64-encoded compressed SEC1 public key
 */
public record PublishedOneTimePreKey(
    @JsonProperty("keyId") int keyId,
    @JsonProperty("publicKey") String publicKeyBase64) {

  public PublishedOneTimePreKey(int keyId, byte[] publicKey) {
    this(keyId, Base64Fields.encode(publicKey));
  }

  public byte[] publicKey() {
    return Base64Fields.decode(publicKeyBase64, "oneTimePreKeys.publicKey");
  }
}
