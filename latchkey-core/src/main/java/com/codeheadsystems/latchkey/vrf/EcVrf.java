package com.codeheadsystems.latchkey.vrf;

import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.exceptions.InvalidProofException;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

/**
 * ECVRF-P256-SHA256-TAI from RFC 9381 section 5.5, suite string 0x01.
 * <p>
 * Encode-to-curve uses try-and-increment, the nonce comes from RFC 6979, so proving is
 * deterministic for a fixed key and alpha string.
 */
class EcVrf {

  static final byte SUITE = 0x01;
  static final int C_LENGTH = 16;

  private static final byte ENCODE_TO_CURVE_DOMAIN = 0x01;
  private static final byte CHALLENGE_DOMAIN = 0x02;
  private static final byte PROOF_TO_HASH_DOMAIN = 0x03;
  private static final byte DOMAIN_BACK = 0x00;

  private final Curve curve;
  private final int ptLen;
  private final int qLen;

  EcVrf(Curve curve) {
    this.curve = curve;
    this.ptLen = curve.compressedPointLength();
    this.qLen = curve.scalarLength();
  }

  int proofLength() {
    return ptLen + C_LENGTH + qLen;
  }

  byte[] publicKey(BigInteger x) {
    return curve.g().multiply(x).normalize().getEncoded(true);
  }

  /**
   * RFC 9381 section 5.1, ECVRF_prove.
   */
  byte[] prove(BigInteger x, byte[] alpha) {
    byte[] y = publicKey(x);
    ECPoint h = encodeToCurve(y, alpha);
    byte[] hString = h.getEncoded(true);
    ECPoint gamma = h.multiply(x).normalize();
    BigInteger k = nonce(x, hString);
    ECPoint u = curve.g().multiply(k).normalize();
    ECPoint v = h.multiply(k).normalize();
    BigInteger c = challenge(y, hString, gamma.getEncoded(true), u.getEncoded(true), v.getEncoded(true));
    BigInteger s = k.add(c.multiply(x)).mod(curve.n());
    return ByteUtils.concat(gamma.getEncoded(true),
        ByteUtils.toFixedLength(c, C_LENGTH),
        ByteUtils.toFixedLength(s, qLen));
  }

  /**
   * RFC 9381 section 5.2, ECVRF_proof_to_hash. Does not verify the proof.
   */
  byte[] proofToHash(byte[] pi) {
    ECPoint gamma = decodeGamma(pi);
    return proofToHash(gamma);
  }

  /**
   * RFC 9381 section 5.3, ECVRF_verify.
   *
   * @return beta, the VRF output
   * @throws InvalidProofException when the proof is malformed or does not verify
   */
  byte[] verify(byte[] publicKey, byte[] pi, byte[] alpha) {
    ECPoint y;
    try {
      y = curve.decodePoint(publicKey);
    } catch (IllegalArgumentException e) {
      throw new InvalidProofException("Invalid VRF public key");
    }
    if (pi == null || pi.length != proofLength()) {
      throw new InvalidProofException("Proof must be " + proofLength() + " bytes");
    }
    ECPoint gamma = decodeGamma(pi);
    BigInteger c = new BigInteger(1, Arrays.copyOfRange(pi, ptLen, ptLen + C_LENGTH));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(pi, ptLen + C_LENGTH, pi.length));
    if (s.compareTo(curve.n()) >= 0) {
      throw new InvalidProofException("Proof scalar out of range");
    }
    ECPoint h = encodeToCurve(publicKey, alpha);
    ECPoint u = curve.g().multiply(s).subtract(y.multiply(c)).normalize();
    ECPoint v = h.multiply(s).subtract(gamma.multiply(c)).normalize();
    BigInteger expected = challenge(publicKey, h.getEncoded(true), gamma.getEncoded(true),
        u.getEncoded(true), v.getEncoded(true));
    if (!expected.equals(c)) {
      throw new InvalidProofException("VRF proof does not verify");
    }
    return proofToHash(gamma);
  }

  /**
   * RFC 9381 section 5.4.1.1, try-and-increment with the public key as salt.
   */
  ECPoint encodeToCurve(byte[] publicKey, byte[] alpha) {
    for (int ctr = 0; ctr < 256; ctr++) {
      byte[] hash = sha256(ByteUtils.concat(new byte[]{SUITE, ENCODE_TO_CURVE_DOMAIN},
          publicKey, alpha, new byte[]{(byte) ctr, DOMAIN_BACK}));
      byte[] candidate = ByteUtils.concat(new byte[]{0x02}, hash);
      try {
        return curve.decodePoint(candidate);
      } catch (IllegalArgumentException e) {
        // x is not on the curve, try the next counter
      }
    }
    throw new IllegalStateException("encode_to_curve failed after 256 attempts");
  }

  private BigInteger nonce(BigInteger x, byte[] hString) {
    HMacDSAKCalculator calculator = new HMacDSAKCalculator(new SHA256Digest());
    calculator.init(curve.n(), x, sha256(hString));
    return calculator.nextK();
  }

  private BigInteger challenge(byte[]... points) {
    byte[] input = ByteUtils.concat(new byte[]{SUITE, CHALLENGE_DOMAIN}, ByteUtils.concat(points),
        new byte[]{DOMAIN_BACK});
    return new BigInteger(1, Arrays.copyOf(sha256(input), C_LENGTH));
  }

  private byte[] proofToHash(ECPoint gamma) {
    ECPoint cofactorGamma = gamma.multiply(curve.h()).normalize();
    return sha256(ByteUtils.concat(new byte[]{SUITE, PROOF_TO_HASH_DOMAIN},
        cofactorGamma.getEncoded(true), new byte[]{DOMAIN_BACK}));
  }

  private ECPoint decodeGamma(byte[] pi) {
    if (pi == null || pi.length != proofLength()) {
      throw new InvalidProofException("Proof must be " + proofLength() + " bytes");
    }
    try {
      return curve.decodePoint(Arrays.copyOf(pi, ptLen));
    } catch (IllegalArgumentException e) {
      throw new InvalidProofException("Invalid gamma point in proof");
    }
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
