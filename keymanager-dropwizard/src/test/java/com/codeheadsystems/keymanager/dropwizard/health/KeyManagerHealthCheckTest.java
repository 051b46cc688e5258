package com.codeheadsystems.keymanager.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keymanager.crypto.KeyEncryptionUnit;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.crypto.MasterKey;
import com.codeheadsystems.keymanager.crypto.RandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyManagerHealthCheckTest {

  private RandomProvider randomProvider;
  private KeyEncryptionUnit encryptionUnit;
  private KeyManagerHealthCheck healthCheck;

  @BeforeEach
  void setUp() {
    randomProvider = new RandomProvider();
    encryptionUnit = new KeyEncryptionUnit(MasterKey.ephemeral(randomProvider), randomProvider);
    healthCheck = new KeyManagerHealthCheck(encryptionUnit, new KeyMaterialFactory(randomProvider), randomProvider);
  }

  @Test
  void healthyWithWorkingKeys() {
    HealthCheck.Result result = healthCheck.execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).startsWith("encryption operations=");
  }

  @Test
  void unhealthyOnceEncryptionUnitIsDestroyed() {
    encryptionUnit.destroy();

    HealthCheck.Result result = healthCheck.execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("round trip failed");
  }
}
