package com.codeheadsystems.keymanager.crypto;

import com.codeheadsystems.keymanager.crypto.exceptions.KeyGenerationException;
import com.codeheadsystems.keymanager.crypto.model.EcKeyPair;
import com.codeheadsystems.keymanager.crypto.model.IdentityKeyPair;
import com.codeheadsystems.keymanager.crypto.model.IdentityPrivateKey;
import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPair;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Stateless producer of key pairs and identity-key signatures.
 * <p>
 * All keys are P-256. Public keys are 33-byte compressed SEC1 points and private keys are
 * 32-byte big-endian scalars. Signatures are deterministic ECDSA (RFC 6979) over SHA-256,
 * encoded as the fixed 64-byte concatenation {@code r || s}.
 */
public class KeyMaterialFactory {

  /**
   * Length of an encoded signature.
   */
  public static final int SIGNATURE_LENGTH = 64;

  private static final int SCALAR_LENGTH = 32;

  private final Curve curve;
  private final RandomProvider randomProvider;

  /**
   * Creates a factory over P-256 with a default secure random source.
   */
  public KeyMaterialFactory() {
    this(new RandomProvider());
  }

  /**
   * Creates a factory over P-256 drawing entropy from the given provider.
   *
   * @param randomProvider the random provider
   */
  public KeyMaterialFactory(final RandomProvider randomProvider) {
    this.curve = Curve.P256_CURVE;
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh key pair.
   *
   * @return the key pair
   * @throws KeyGenerationException if the random source fails
   */
  public EcKeyPair generateKeyPair() {
    ECKeyPairGenerator generator = new ECKeyPairGenerator();
    try {
      generator.init(new ECKeyGenerationParameters(curve.params(), randomProvider.random()));
      AsymmetricCipherKeyPair pair = generator.generateKeyPair();
      BigInteger d = ((ECPrivateKeyParameters) pair.getPrivate()).getD();
      ECPoint q = ((ECPublicKeyParameters) pair.getPublic()).getQ();
      return new EcKeyPair(curve.encodePublicKey(q), curve.encodePrivateKey(d));
    } catch (RuntimeException e) {
      throw new KeyGenerationException("Key pair generation failed", e);
    }
  }

  /**
   * Generates a fresh identity key pair.
   *
   * @return the identity key pair
   */
  public IdentityKeyPair generateIdentityKeyPair() {
    return IdentityKeyPair.from(generateKeyPair());
  }

  /**
   * Generates a fresh pre-key pair, for either the signed pre-key or the one-time pool.
   *
   * @return the pre-key pair
   */
  public PreKeyPair generatePreKeyPair() {
    return PreKeyPair.from(generateKeyPair());
  }

  /**
   * Generates {@code count} pre-key pairs.
   *
   * @param count number of pairs, zero yields an empty list
   * @return the pairs
   */
  public List<PreKeyPair> generateBatch(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Batch size must not be negative: " + count);
    }
    List<PreKeyPair> batch = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      batch.add(generatePreKeyPair());
    }
    return batch;
  }

  /**
   * Signs {@code message} with the identity private key.
   *
   * @param message    the bytes to sign, typically a pre-key's encoded public key
   * @param privateKey the identity private key
   * @return the 64-byte signature
   * @throws IllegalArgumentException if the private key is malformed
   */
  public byte[] sign(byte[] message, IdentityPrivateKey privateKey) {
    BigInteger d = curve.decodePrivateKey(privateKey.bytes());
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(d, curve.params()));
    BigInteger[] rs = signer.generateSignature(sha256(message));
    return ByteUtils.concat(
        ByteUtils.toFixedLength(rs[0], SCALAR_LENGTH),
        ByteUtils.toFixedLength(rs[1], SCALAR_LENGTH));
  }

  /**
   * Verifies a signature produced by {@link #sign}.
   * <p>
   * Malformed keys or signatures verify as {@code false}; a counterpart never trusts them.
   *
   * @param message   the signed bytes
   * @param signature the 64-byte signature
   * @param publicKey the identity public key
   * @return true if the signature is valid
   */
  public boolean verify(byte[] message, byte[] signature, IdentityPublicKey publicKey) {
    if (message == null || signature == null || signature.length != SIGNATURE_LENGTH) {
      return false;
    }
    ECPoint q;
    try {
      q = curve.decodePublicKey(publicKey.bytes());
    } catch (IllegalArgumentException e) {
      return false;
    }
    BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, SCALAR_LENGTH));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, SCALAR_LENGTH, SIGNATURE_LENGTH));
    if (r.signum() == 0 || s.signum() == 0 || r.compareTo(curve.n()) >= 0 || s.compareTo(curve.n()) >= 0) {
      return false;
    }
    ECDSASigner verifier = new ECDSASigner();
    verifier.init(false, new ECPublicKeyParameters(q, curve.params()));
    return verifier.verifySignature(sha256(message), r, s);
  }

  /**
   * Recomputes the public key belonging to a private scalar.
   *
   * @param privateKey fixed-length private scalar
   * @return the compressed public key
   * @throws IllegalArgumentException if the private key is malformed
   */
  public byte[] derivePublicKey(byte[] privateKey) {
    BigInteger d = curve.decodePrivateKey(privateKey);
    return curve.encodePublicKey(curve.g().multiply(d));
  }

  private static byte[] sha256(byte[] message) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(message, 0, message.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
