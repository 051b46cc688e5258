package com.codeheadsystems.keymanager.crypto;

import com.codeheadsystems.keymanager.crypto.exceptions.KeyGenerationException;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used by {@link KeyMaterialFactory} for key generation and by {@link KeyEncryptionUnit}
 * for nonce generation.
 * <p>
 * A failing random source is never recoverable: every failure surfaces as a
 * {@link KeyGenerationException}.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    try {
      random.nextBytes(out);
    } catch (RuntimeException e) {
      throw new KeyGenerationException("Secure random source failed", e);
    }
    return out;
  }

  /**
   * Returns a uniformly distributed int in {@code [origin, bound)}.
   *
   * @param origin inclusive lower bound
   * @param bound  exclusive upper bound
   * @return the random value
   */
  public int randomInt(int origin, int bound) {
    if (bound <= origin) {
      throw new IllegalArgumentException("bound must be greater than origin");
    }
    try {
      return origin + random.nextInt(bound - origin);
    } catch (RuntimeException e) {
      throw new KeyGenerationException("Secure random source failed", e);
    }
  }
}
