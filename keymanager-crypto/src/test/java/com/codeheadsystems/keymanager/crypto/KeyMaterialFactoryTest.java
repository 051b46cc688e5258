package com.codeheadsystems.keymanager.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keymanager.crypto.exceptions.KeyGenerationException;
import com.codeheadsystems.keymanager.crypto.model.EcKeyPair;
import com.codeheadsystems.keymanager.crypto.model.IdentityKeyPair;
import com.codeheadsystems.keymanager.crypto.model.IdentityPrivateKey;
import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPair;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeyMaterialFactoryTest {

  private final KeyMaterialFactory factory = new KeyMaterialFactory();

  // ─── Generation ───────────────────────────────────────────────────────────

  @Test
  void generateKeyPair_producesWellFormedKeys() {
    EcKeyPair pair = factory.generateKeyPair();

    assertThat(pair.publicKey()).hasSize(Curve.PUBLIC_KEY_LENGTH);
    assertThat(pair.privateKey()).hasSize(Curve.PRIVATE_KEY_LENGTH);
    assertThat(factory.derivePublicKey(pair.privateKey())).isEqualTo(pair.publicKey());
  }

  @Test
  void generateKeyPair_neverRepeats() {
    EcKeyPair a = factory.generateKeyPair();
    EcKeyPair b = factory.generateKeyPair();

    assertThat(a.privateKey()).isNotEqualTo(b.privateKey());
    assertThat(a.publicKey()).isNotEqualTo(b.publicKey());
  }

  @Test
  void generateBatch_returnsRequestedCount() {
    List<PreKeyPair> batch = factory.generateBatch(5);

    assertThat(batch).hasSize(5);
    assertThat(batch).extracting(PreKeyPair::publicKey).doesNotHaveDuplicates();
  }

  @Test
  void generateBatch_zeroIsEmpty() {
    assertThat(factory.generateBatch(0)).isEmpty();
  }

  @Test
  void generateBatch_negativeThrows() {
    assertThatThrownBy(() -> factory.generateBatch(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void generateKeyPair_brokenEntropyIsFatal() {
    KeyMaterialFactory broken = new KeyMaterialFactory(
        new RandomProvider(new RandomProviderTest.FailingSecureRandom()));

    assertThatThrownBy(broken::generateKeyPair)
        .isInstanceOf(KeyGenerationException.class);
  }

  // ─── Signatures ───────────────────────────────────────────────────────────

  @Test
  void sign_thenVerify_succeeds() {
    IdentityKeyPair identity = factory.generateIdentityKeyPair();
    PreKeyPair preKey = factory.generatePreKeyPair();

    byte[] signature = factory.sign(preKey.publicKey().bytes(), identity.privateKey());

    assertThat(signature).hasSize(KeyMaterialFactory.SIGNATURE_LENGTH);
    assertThat(factory.verify(preKey.publicKey().bytes(), signature, identity.publicKey())).isTrue();
  }

  @Test
  void sign_isDeterministic() {
    IdentityKeyPair identity = factory.generateIdentityKeyPair();
    byte[] message = "message".getBytes();

    assertThat(factory.sign(message, identity.privateKey()))
        .isEqualTo(factory.sign(message, identity.privateKey()));
  }

  @Test
  void verify_tamperedPublicKeyFails() {
    IdentityKeyPair identity = factory.generateIdentityKeyPair();
    byte[] preKeyPublic = factory.generatePreKeyPair().publicKey().bytes();
    byte[] signature = factory.sign(preKeyPublic, identity.privateKey());

    for (int i = 0; i < preKeyPublic.length; i++) {
      byte[] tampered = preKeyPublic.clone();
      tampered[i] ^= 0x01;
      assertThat(factory.verify(tampered, signature, identity.publicKey()))
          .as("flipped byte %d", i)
          .isFalse();
    }
  }

  @Test
  void verify_tamperedSignatureFails() {
    IdentityKeyPair identity = factory.generateIdentityKeyPair();
    byte[] message = factory.generatePreKeyPair().publicKey().bytes();
    byte[] signature = factory.sign(message, identity.privateKey());
    signature[10] ^= 0x40;

    assertThat(factory.verify(message, signature, identity.publicKey())).isFalse();
  }

  @Test
  void verify_wrongIdentityFails() {
    IdentityKeyPair signer = factory.generateIdentityKeyPair();
    IdentityKeyPair other = factory.generateIdentityKeyPair();
    byte[] message = "pre-key".getBytes();

    assertThat(factory.verify(message, factory.sign(message, signer.privateKey()), other.publicKey()))
        .isFalse();
  }

  @Test
  void verify_malformedInputsReturnFalse() {
    IdentityKeyPair identity = factory.generateIdentityKeyPair();
    byte[] message = "m".getBytes();
    byte[] signature = factory.sign(message, identity.privateKey());

    assertThat(factory.verify(message, new byte[12], identity.publicKey())).isFalse();
    assertThat(factory.verify(message, new byte[64], identity.publicKey())).isFalse();
    assertThat(factory.verify(message, signature, new IdentityPublicKey(new byte[33]))).isFalse();
    assertThat(factory.verify(null, signature, identity.publicKey())).isFalse();
  }

  @Test
  void sign_malformedPrivateKeyFailsLoudly() {
    assertThatThrownBy(() -> factory.sign("m".getBytes(), new IdentityPrivateKey(new byte[5])))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> factory.sign("m".getBytes(), new IdentityPrivateKey(new byte[32])))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
