package com.codeheadsystems.keymanager.client.verifier;

import com.codeheadsystems.keymanager.client.exceptions.KeyBundleVerificationException;
import com.codeheadsystems.keymanager.client.model.VerifiedKeyBundle;
import com.codeheadsystems.keymanager.crypto.Curve;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;
import com.codeheadsystems.keymanager.model.PublishedKeyBundle;
import com.codeheadsystems.keymanager.model.PublishedOneTimePreKey;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a fetched bundle before a handshake is started against it: every key must decode as a
 * P-256 point and the signed pre-key signature must verify under the identity key.
 * <p>
 * Whether the identity key itself belongs to the account is out of scope; that is a trust
 * decision of the caller.
 */
@Singleton
public class KeyBundleVerifier {
  private static final Logger log = LoggerFactory.getLogger(KeyBundleVerifier.class);

  private final KeyMaterialFactory keyMaterialFactory;
  private final Curve curve;

  @Inject
  public KeyBundleVerifier(final KeyMaterialFactory keyMaterialFactory) {
    this.keyMaterialFactory = keyMaterialFactory;
    this.curve = Curve.P256_CURVE;
  }

  /**
   * Verifies a bundle.
   *
   * @param bundle the fetched bundle
   * @return the typed, verified bundle
   * @throws KeyBundleVerificationException if any check fails
   */
  public VerifiedKeyBundle verify(final PublishedKeyBundle bundle) {
    if (bundle == null || bundle.signedPreKey() == null) {
      throw new KeyBundleVerificationException("Bundle has no signed pre-key");
    }
    try {
      IdentityPublicKey identityKey = new IdentityPublicKey(validPoint(bundle.identityKey()));
      PreKeyPublicKey signedPreKey = new PreKeyPublicKey(validPoint(bundle.signedPreKey().publicKey()));
      if (!keyMaterialFactory.verify(signedPreKey.bytes(), bundle.signedPreKey().signature(), identityKey)) {
        log.warn("Signed pre-key {} failed signature verification", bundle.signedPreKey().keyId());
        throw new KeyBundleVerificationException(
            "Signed pre-key " + bundle.signedPreKey().keyId() + " signature does not verify under the identity key");
      }
      Set<Integer> seen = new HashSet<>();
      List<VerifiedKeyBundle.OneTimePreKey> oneTimePreKeys = new ArrayList<>();
      for (PublishedOneTimePreKey key : bundle.oneTimePreKeys()) {
        if (!seen.add(key.keyId())) {
          throw new KeyBundleVerificationException("Duplicate one-time pre-key id " + key.keyId());
        }
        oneTimePreKeys.add(new VerifiedKeyBundle.OneTimePreKey(key.keyId(), new PreKeyPublicKey(validPoint(key.publicKey()))));
      }
      return new VerifiedKeyBundle(identityKey, bundle.registrationId(), bundle.signedPreKey().keyId(),
          signedPreKey, oneTimePreKeys);
    } catch (IllegalArgumentException e) {
      throw new KeyBundleVerificationException("Malformed key bundle: " + e.getMessage(), e);
    }
  }

  private byte[] validPoint(byte[] encoded) {
    curve.decodePublicKey(encoded);
    return encoded;
  }
}
