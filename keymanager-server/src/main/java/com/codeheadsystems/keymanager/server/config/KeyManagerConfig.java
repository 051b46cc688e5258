package com.codeheadsystems.keymanager.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the key manager.
 *
 * @param lowWaterMark            unused one-time pre-key count below which the pool is replenished
 * @param targetPoolSize          unused count the pool is replenished back up to
 * @param publicationBatchSize    max one-time pre-keys included in a single published bundle
 * @param rotationSchedule        lifetime of a signed pre-key
 * @param signedPreKeyGracePeriod how long a superseded signed pre-key stays readable for
 *                                in-flight handshakes
 * @param cacheTtl                how long a cached signed pre-key is trusted before it is
 *                                re-checked against the store
 * @param storageTimeout          bound on a single key store operation
 */
public record KeyManagerConfig(
    int lowWaterMark,
    int targetPoolSize,
    int publicationBatchSize,
    RotationSchedule rotationSchedule,
    Duration signedPreKeyGracePeriod,
    Duration cacheTtl,
    Duration storageTimeout) {

  public static final int DEFAULT_LOW_WATER_MARK = 25;
  public static final int DEFAULT_TARGET_POOL_SIZE = 50;
  public static final int DEFAULT_PUBLICATION_BATCH_SIZE = 10;
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofDays(7);
  public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_STORAGE_TIMEOUT = Duration.ofSeconds(5);

  public KeyManagerConfig {
    Objects.requireNonNull(rotationSchedule, "rotationSchedule");
    Objects.requireNonNull(signedPreKeyGracePeriod, "signedPreKeyGracePeriod");
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    Objects.requireNonNull(storageTimeout, "storageTimeout");
    if (lowWaterMark < 1) {
      throw new IllegalArgumentException("lowWaterMark must be positive: " + lowWaterMark);
    }
    if (targetPoolSize < lowWaterMark) {
      throw new IllegalArgumentException(
          "targetPoolSize (" + targetPoolSize + ") must be at least lowWaterMark (" + lowWaterMark + ")");
    }
    if (publicationBatchSize < 0) {
      throw new IllegalArgumentException("publicationBatchSize must not be negative: " + publicationBatchSize);
    }
    if (signedPreKeyGracePeriod.isNegative()) {
      throw new IllegalArgumentException("signedPreKeyGracePeriod must not be negative");
    }
    if (cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must not be negative");
    }
    if (storageTimeout.isNegative() || storageTimeout.isZero()) {
      throw new IllegalArgumentException("storageTimeout must be positive");
    }
  }

  /**
   * Pool of 50 refilled below 25, 10 keys per publication, weekly rotation with a one-week grace.
   *
   * @return the defaults
   */
  public static KeyManagerConfig defaults() {
    return new KeyManagerConfig(
        DEFAULT_LOW_WATER_MARK,
        DEFAULT_TARGET_POOL_SIZE,
        DEFAULT_PUBLICATION_BATCH_SIZE,
        RotationSchedule.WEEKLY,
        DEFAULT_GRACE_PERIOD,
        DEFAULT_CACHE_TTL,
        DEFAULT_STORAGE_TIMEOUT);
  }
}
