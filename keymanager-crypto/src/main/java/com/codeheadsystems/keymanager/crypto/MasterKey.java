package com.codeheadsystems.keymanager.crypto;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The process-wide AES-256 key protecting private key material at rest.
 * <p>
 * In production the bytes come from an HSM or an external key-management service and are
 * injected at startup. Never logged and never serialized: {@link #toString()} is redacted.
 */
public final class MasterKey {

  private static final Logger log = LoggerFactory.getLogger(MasterKey.class);

  /**
   * Required key length in bytes.
   */
  public static final int LENGTH = 32;

  private final byte[] key;
  private final boolean ephemeral;

  private MasterKey(byte[] key, boolean ephemeral) {
    this.key = key;
    this.ephemeral = ephemeral;
  }

  /**
   * Wraps a copy of the given key bytes.
   *
   * @param key 32 key bytes
   * @return the master key
   */
  public static MasterKey of(byte[] key) {
    if (key == null || key.length != LENGTH) {
      throw new IllegalArgumentException("Master key must be " + LENGTH + " bytes");
    }
    return new MasterKey(key.clone(), false);
  }

  /**
   * Parses a hex-encoded master key (e.g. the output of {@code openssl rand -hex 32}).
   *
   * @param hex 64 hex characters
   * @return the master key
   */
  public static MasterKey fromHex(String hex) {
    if (hex == null || hex.isBlank()) {
      throw new IllegalArgumentException("Master key hex is missing");
    }
    byte[] decoded;
    try {
      decoded = Hex.decode(hex.trim());
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Master key is not valid hex", e);
    }
    try {
      return of(decoded);
    } finally {
      ByteUtils.zeroize(decoded);
    }
  }

  /**
   * Generates a throwaway random master key. Everything encrypted with it is unreadable after a
   * restart, so this is for development and tests only.
   *
   * @param randomProvider the random provider
   * @return the master key
   */
  public static MasterKey ephemeral(RandomProvider randomProvider) {
    log.warn("Using ephemeral master key - stored keys will be unreadable after restart (development only)");
    return new MasterKey(randomProvider.randomBytes(LENGTH), true);
  }

  /**
   * Whether this key was randomly generated instead of injected.
   */
  public boolean isEphemeral() {
    return ephemeral;
  }

  byte[] keyBytes() {
    return key;
  }

  void destroy() {
    ByteUtils.zeroize(key);
  }

  @Override
  public String toString() {
    return "MasterKey[<redacted>]";
  }
}
