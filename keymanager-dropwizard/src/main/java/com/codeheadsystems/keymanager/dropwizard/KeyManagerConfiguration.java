package com.codeheadsystems.keymanager.dropwizard;

import com.codeheadsystems.keymanager.server.config.KeyManagerConfig;
import com.codeheadsystems.keymanager.server.config.RotationSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the key manager.
 * <p>
 * For production, supply {@code masterKeyHex} (a hex-encoded 32-byte AES key) so that stored
 * private keys stay readable across restarts. Without it the bundle refuses to start unless
 * {@code allowEphemeralMasterKey} is set (dev/test only: every stored key becomes unreadable
 * after a restart).
 * <p>
 * Generate a key with: {@code openssl rand -hex 32}
 */
public class KeyManagerConfiguration extends Configuration {

  /**
   * Hex-encoded 32-byte master key sealing every stored private key.
   */
  private String masterKeyHex = "";

  /**
   * Start with a random master key when {@code masterKeyHex} is empty.
   */
  private boolean allowEphemeralMasterKey = false;

  /**
   * Unused one-time pre-key count below which the pool is refilled.
   */
  @Min(1)
  private int lowWaterMark = KeyManagerConfig.DEFAULT_LOW_WATER_MARK;

  /**
   * Pool size a refill restores.
   */
  @Min(1)
  private int targetPoolSize = KeyManagerConfig.DEFAULT_TARGET_POOL_SIZE;

  /**
   * One-time pre-keys included in a published bundle.
   */
  @Min(0)
  private int publicationBatchSize = KeyManagerConfig.DEFAULT_PUBLICATION_BATCH_SIZE;

  /**
   * {@code WEEKLY} or {@code MONTHLY}.
   */
  @NotNull
  private RotationSchedule rotationSchedule = RotationSchedule.WEEKLY;

  @NotNull
  private Duration signedPreKeyGracePeriod = Duration.days(7);

  @NotNull
  private Duration cacheTtl = Duration.seconds(60);

  @NotNull
  private Duration storageTimeout = Duration.seconds(5);

  /**
   * How often the rotation scheduler sweeps the managed accounts.
   */
  @NotNull
  private Duration rotationCheckInterval = Duration.hours(1);

  /**
   * Accounts initialized when the application starts.
   */
  @NotNull
  private List<String> bootstrapAccounts = new ArrayList<>();

  /**
   * Maps the YAML values onto the key manager's tunables.
   *
   * @return the key manager config
   */
  public KeyManagerConfig toKeyManagerConfig() {
    return new KeyManagerConfig(
        lowWaterMark,
        targetPoolSize,
        publicationBatchSize,
        rotationSchedule,
        signedPreKeyGracePeriod.toJavaDuration(),
        cacheTtl.toJavaDuration(),
        storageTimeout.toJavaDuration());
  }

  /**
   * Gets master key hex.
   *
   * @return the master key hex
   */
  @JsonProperty
  public String getMasterKeyHex() {
    return masterKeyHex;
  }

  /**
   * Sets master key hex.
   *
   * @param masterKeyHex the master key hex
   */
  @JsonProperty
  public void setMasterKeyHex(String masterKeyHex) {
    this.masterKeyHex = masterKeyHex;
  }

  @JsonProperty
  public boolean isAllowEphemeralMasterKey() {
    return allowEphemeralMasterKey;
  }

  @JsonProperty
  public void setAllowEphemeralMasterKey(boolean allowEphemeralMasterKey) {
    this.allowEphemeralMasterKey = allowEphemeralMasterKey;
  }

  @JsonProperty
  public int getLowWaterMark() {
    return lowWaterMark;
  }

  @JsonProperty
  public void setLowWaterMark(int lowWaterMark) {
    this.lowWaterMark = lowWaterMark;
  }

  @JsonProperty
  public int getTargetPoolSize() {
    return targetPoolSize;
  }

  @JsonProperty
  public void setTargetPoolSize(int targetPoolSize) {
    this.targetPoolSize = targetPoolSize;
  }

  @JsonProperty
  public int getPublicationBatchSize() {
    return publicationBatchSize;
  }

  @JsonProperty
  public void setPublicationBatchSize(int publicationBatchSize) {
    this.publicationBatchSize = publicationBatchSize;
  }

  @JsonProperty
  public RotationSchedule getRotationSchedule() {
    return rotationSchedule;
  }

  @JsonProperty
  public void setRotationSchedule(RotationSchedule rotationSchedule) {
    this.rotationSchedule = rotationSchedule;
  }

  @JsonProperty
  public Duration getSignedPreKeyGracePeriod() {
    return signedPreKeyGracePeriod;
  }

  @JsonProperty
  public void setSignedPreKeyGracePeriod(Duration signedPreKeyGracePeriod) {
    this.signedPreKeyGracePeriod = signedPreKeyGracePeriod;
  }

  @JsonProperty
  public Duration getCacheTtl() {
    return cacheTtl;
  }

  @JsonProperty
  public void setCacheTtl(Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  @JsonProperty
  public Duration getStorageTimeout() {
    return storageTimeout;
  }

  @JsonProperty
  public void setStorageTimeout(Duration storageTimeout) {
    this.storageTimeout = storageTimeout;
  }

  @JsonProperty
  public Duration getRotationCheckInterval() {
    return rotationCheckInterval;
  }

  @JsonProperty
  public void setRotationCheckInterval(Duration rotationCheckInterval) {
    this.rotationCheckInterval = rotationCheckInterval;
  }

  @JsonProperty
  public List<String> getBootstrapAccounts() {
    return bootstrapAccounts;
  }

  @JsonProperty
  public void setBootstrapAccounts(List<String> bootstrapAccounts) {
    this.bootstrapAccounts = bootstrapAccounts;
  }
}
