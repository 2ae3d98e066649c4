package com.codeheadsystems.latchkey.vrf;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Elliptic curve domain parameters plus SEC1 point validation.
 *
 * @param params the BouncyCastle domain parameters
 * @param curve  the curve
 * @param g      the generator
 * @param n      the group order
 * @param h      the cofactor
 */
public record Curve(ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, BigInteger h) {

  /**
   * NIST P-256, the curve of the ECVRF-P256-SHA256-TAI suite.
   */
  public static final Curve P256_CURVE = loadCurve("P-256");

  /**
   * Instantiates a new Curve.
   *
   * @param params the params
   */
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
   * Length in bytes of a scalar modulo {@link #n()}.
   *
   * @return the scalar length
   */
  public int scalarLength() {
    return (n.bitLength() + 7) / 8;
  }

  /**
   * Length in bytes of a compressed SEC1 point.
   *
   * @return the point length
   */
  public int compressedPointLength() {
    return (curve.getFieldSize() + 7) / 8 + 1;
  }

  /**
   * Decodes a compressed SEC1 point, rejecting the identity and anything off the curve.
   *
   * @param encoded the encoded point
   * @return the normalized point
   * @throws IllegalArgumentException if the encoding is not a valid non-identity point
   */
  public ECPoint decodePoint(byte[] encoded) {
    if (encoded == null || encoded.length != compressedPointLength()) {
      throw new IllegalArgumentException("Expected a compressed point of " + compressedPointLength() + " bytes");
    }
    ECPoint point = curve.decodePoint(encoded).normalize();
    if (point.isInfinity() || !point.isValid()) {
      throw new IllegalArgumentException("Point is not a valid curve element");
    }
    return point;
  }
}
