package com.codeheadsystems.keymanager.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keymanager.crypto.KeyEncryptionUnit;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.crypto.RandomProvider;
import com.codeheadsystems.keymanager.crypto.exceptions.KeyAuthenticationException;
import com.codeheadsystems.keymanager.crypto.model.IdentityKeyPair;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Health check that seals and opens a throwaway key and signs and verifies with a throwaway
 * identity, proving the master key and the curve arithmetic work.
 */
public class KeyManagerHealthCheck extends HealthCheck {

  private static final byte[] PROBE_MESSAGE = "key-manager-health".getBytes(StandardCharsets.UTF_8);

  private final KeyEncryptionUnit encryptionUnit;
  private final KeyMaterialFactory keyMaterialFactory;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Key manager health check.
   *
   * @param encryptionUnit     the encryption unit
   * @param keyMaterialFactory the key material factory
   * @param randomProvider     the random provider
   */
  public KeyManagerHealthCheck(KeyEncryptionUnit encryptionUnit,
                               KeyMaterialFactory keyMaterialFactory,
                               RandomProvider randomProvider) {
    this.encryptionUnit = encryptionUnit;
    this.keyMaterialFactory = keyMaterialFactory;
    this.randomProvider = randomProvider;
  }

  @Override
  protected Result check() {
    byte[] probe = randomProvider.randomBytes(32);
    try {
      if (!Arrays.equals(probe, encryptionUnit.decrypt(encryptionUnit.encrypt(probe)))) {
        return Result.unhealthy("Key encryption round trip returned different bytes");
      }
    } catch (KeyAuthenticationException | IllegalStateException e) {
      return Result.unhealthy("Key encryption round trip failed: %s", e.getMessage());
    }
    IdentityKeyPair identity = keyMaterialFactory.generateIdentityKeyPair();
    byte[] signature = keyMaterialFactory.sign(PROBE_MESSAGE, identity.privateKey());
    identity.privateKey().destroy();
    if (!keyMaterialFactory.verify(PROBE_MESSAGE, signature, identity.publicKey())) {
      return Result.unhealthy("Signature round trip failed");
    }
    return Result.healthy("encryption operations=%d", encryptionUnit.operationCount());
  }
}
