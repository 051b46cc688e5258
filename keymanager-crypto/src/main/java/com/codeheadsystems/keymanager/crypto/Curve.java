package com.codeheadsystems.keymanager.crypto;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Domain parameters of the single curve used for every key type.
 * <p>
 * Identity keys, signed pre-keys and one-time pre-keys must all live on the same curve so that
 * counterparts can run the X3DH Diffie-Hellman combinations across them.
 */
public record Curve(ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, BigInteger h) {

  public static final Curve P256_CURVE = loadCurve("P-256");

  /**
   * Compressed SEC1 encoding length of a P-256 point.
   */
  public static final int PUBLIC_KEY_LENGTH = 33;

  /**
   * Fixed big-endian encoding length of a P-256 scalar.
   */
  public static final int PRIVATE_KEY_LENGTH = 32;

  public Curve(ECDomainParameters params) {
    this(params, params.getCurve(), params.getG(), params.getN(), params.getH());
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(new ECDomainParameters(
        params.getCurve(),
        params.getG(),
        params.getN(),
        params.getH()
    ));
  }

  /**
   * Decodes a compressed SEC1 point and rejects anything off the curve or at infinity.
   *
   * @param encoded the encoded point
   * @return the validated point
   * @throws IllegalArgumentException if the encoding is not a valid public key
   */
  public ECPoint decodePublicKey(byte[] encoded) {
    if (encoded == null || encoded.length != PUBLIC_KEY_LENGTH) {
      throw new IllegalArgumentException("Public key must be a " + PUBLIC_KEY_LENGTH + "-byte compressed point");
    }
    ECPoint point;
    try {
      point = curve.decodePoint(encoded).normalize();
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Public key is not a point on the curve", e);
    }
    if (point.isInfinity() || !point.isValid()) {
      throw new IllegalArgumentException("Public key is not a valid curve point");
    }
    return point;
  }

  /**
   * Decodes a fixed-length private scalar and checks it lies in [1, n-1].
   *
   * @param encoded the encoded scalar
   * @return the scalar
   * @throws IllegalArgumentException if the encoding is malformed or out of range
   */
  public BigInteger decodePrivateKey(byte[] encoded) {
    if (encoded == null || encoded.length != PRIVATE_KEY_LENGTH) {
      throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_LENGTH + " bytes");
    }
    BigInteger d = new BigInteger(1, encoded);
    if (d.signum() <= 0 || d.compareTo(n) >= 0) {
      throw new IllegalArgumentException("Private key scalar out of range");
    }
    return d;
  }

  /**
   * Serializes a point to compressed SEC1.
   */
  public byte[] encodePublicKey(ECPoint point) {
    return point.normalize().getEncoded(true);
  }

  /**
   * Serializes a scalar to its fixed-length big-endian form.
   */
  public byte[] encodePrivateKey(BigInteger d) {
    return ByteUtils.toFixedLength(d, PRIVATE_KEY_LENGTH);
  }
}
