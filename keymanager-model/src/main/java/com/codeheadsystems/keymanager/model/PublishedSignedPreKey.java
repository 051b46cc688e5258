package com.codeheadsystems.keymanager.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model of the active signed pre-key inside a published bundle.
 * <p>
 * The signature covers the raw public key bytes and was produced with the bundle's identity key.
 * Receivers must verify it before trusting the key.
 *
 * @param keyId           the signed pre-key id
 * @param publicKeyBase64 base64-encoded compressed SEC1 public key
 * @param signatureBase64 base64-encoded 64-byte {@code r || s} signature
 */
public record PublishedSignedPreKey(
    @JsonProperty("keyId") int keyId,
    @JsonProperty("publicKey") String publicKeyBase64,
    @JsonProperty("signature") String signatureBase64) {

  public PublishedSignedPreKey(int keyId, byte[] publicKey, byte[] signature) {
    this(keyId, Base64Fields.encode(publicKey), Base64Fields.encode(signature));
  }

  public byte[] publicKey() {
    return Base64Fields.decode(publicKeyBase64, "signedPreKey.publicKey");
  }

  public byte[] signature() {
    return Base64Fields.decode(signatureBase64, "signedPreKey.signature");
  }
}
