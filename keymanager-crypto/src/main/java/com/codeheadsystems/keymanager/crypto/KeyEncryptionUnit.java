package com.codeheadsystems.keymanager.crypto;

import com.codeheadsystems.keymanager.crypto.exceptions.KeyAuthenticationException;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-256-GCM protection of private key bytes at rest.
 * <p>
 * Blob layout: {@code version(1) || nonce(12) || ciphertext || tag(16)}. Every call draws a
 * fresh random 96-bit nonce, and the version byte is bound in as associated data. Decryption
 * is self-contained given the master key.
 * <p>
 * Thread-safe: a new cipher instance is created per call.
 */
public class KeyEncryptionUnit {

  static final byte VERSION = 0x01;
  static final int NONCE_LENGTH = 12;
  static final int TAG_LENGTH = 16;
  private static final int HEADER_LENGTH = 1 + NONCE_LENGTH;
  private static final byte[] AAD = new byte[]{VERSION};

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final MasterKey masterKey;
  private final RandomProvider randomProvider;
  private final AtomicLong operations = new AtomicLong();
  private volatile boolean destroyed;

  /**
   * Instantiates a new Key encryption unit.
   *
   * @param masterKey      the master key
   * @param randomProvider source of nonces
   */
  public KeyEncryptionUnit(final MasterKey masterKey, final RandomProvider randomProvider) {
    this.masterKey = masterKey;
    this.randomProvider = randomProvider;
  }

  /**
   * Encrypts private key bytes.
   *
   * @param plaintext the key bytes
   * @return the self-contained blob
   */
  public byte[] encrypt(byte[] plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext must not be null");
    }
    byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
    GCMModeCipher cipher = newCipher(true, nonce);
    byte[] out = new byte[HEADER_LENGTH + cipher.getOutputSize(plaintext.length)];
    out[0] = VERSION;
    System.arraycopy(nonce, 0, out, 1, NONCE_LENGTH);
    int len = cipher.processBytes(plaintext, 0, plaintext.length, out, HEADER_LENGTH);
    try {
      cipher.doFinal(out, HEADER_LENGTH + len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("AES-GCM encryption failed", e);
    }
    operations.incrementAndGet();
    return out;
  }

  /**
   * Decrypts a blob produced by {@link #encrypt}.
   *
   * @param blob the blob
   * @return the key bytes
   * @throws KeyAuthenticationException if the blob is truncated, of an unknown version, or
   *                                    fails tag verification
   */
  public byte[] decrypt(byte[] blob) {
    if (blob == null || blob.length < HEADER_LENGTH + TAG_LENGTH) {
      throw new KeyAuthenticationException("Encrypted key blob is truncated");
    }
    if (blob[0] != VERSION) {
      throw new KeyAuthenticationException("Unknown encrypted key version: " + blob[0]);
    }
    byte[] nonce = Arrays.copyOfRange(blob, 1, HEADER_LENGTH);
    GCMModeCipher cipher = newCipher(false, nonce);
    int bodyLength = blob.length - HEADER_LENGTH;
    byte[] out = new byte[cipher.getOutputSize(bodyLength)];
    int len = cipher.processBytes(blob, HEADER_LENGTH, bodyLength, out, 0);
    try {
      len += cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      ByteUtils.zeroize(out);
      throw new KeyAuthenticationException("Encrypted key failed authentication", e);
    }
    operations.incrementAndGet();
    if (len == out.length) {
      return out;
    }
    byte[] trimmed = Arrays.copyOf(out, len);
    ByteUtils.zeroize(out);
    return trimmed;
  }

  /**
   * Encrypts and base64-encodes, for string-typed storage columns.
   *
   * @param plaintext the key bytes
   * @return base64 of the blob
   */
  public String encryptToBase64(byte[] plaintext) {
    return B64.encodeToString(encrypt(plaintext));
  }

  /**
   * Reverses {@link #encryptToBase64}.
   *
   * @param encoded base64 of the blob
   * @return the key bytes
   */
  public byte[] decryptFromBase64(String encoded) {
    byte[] blob;
    try {
      blob = B64D.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new KeyAuthenticationException("Encrypted key is not valid base64", e);
    }
    return decrypt(blob);
  }

  /**
   * Number of successful encrypt and decrypt calls.
   *
   * @return the count
   */
  public long operationCount() {
    return operations.get();
  }

  /**
   * Zeroizes the master key. Any later call fails.
   */
  public void destroy() {
    destroyed = true;
    masterKey.destroy();
  }

  private GCMModeCipher newCipher(boolean forEncryption, byte[] nonce) {
    if (destroyed) {
      throw new IllegalStateException("Key encryption unit has been destroyed");
    }
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption,
        new AEADParameters(new KeyParameter(masterKey.keyBytes()), TAG_LENGTH * 8, nonce, AAD));
    return cipher;
  }
}
