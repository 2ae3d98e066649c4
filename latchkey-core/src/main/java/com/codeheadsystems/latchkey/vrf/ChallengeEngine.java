package com.codeheadsystems.latchkey.vrf;

import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.exceptions.InvalidProofException;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds freshness-bound challenge inputs and evaluates or verifies VRF proofs over them.
 * <p>
 * Evaluation is deterministic for a fixed {@code (secretKey, input)}: a retried ceremony with
 * the same input yields the same challenge, and inputs are unique per user, session and block.
 */
public class ChallengeEngine {

  private static final Logger log = LoggerFactory.getLogger(ChallengeEngine.class);

  private final Curve curve;
  private final EcVrf vrf;

  /**
   * Instantiates a new Challenge engine over P-256.
   */
  public ChallengeEngine() {
    this(Curve.P256_CURVE);
  }

  ChallengeEngine(Curve curve) {
    this.curve = curve;
    this.vrf = new EcVrf(curve);
  }

  /**
   * Builds the canonical challenge input. Variable-length fields are length-prefixed so no two
   * distinct contexts share an encoding.
   *
   * @param ctx the context
   * @return the challenge input
   */
  public ChallengeInput buildChallenge(ChallengeContext ctx) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeField(out, ctx.domainSeparator().getBytes(StandardCharsets.UTF_8));
    writeField(out, ctx.userId().getBytes(StandardCharsets.UTF_8));
    writeField(out, ctx.rpId().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    out.writeBytes(ByteUtils.littleEndian64(ctx.blockHeight()));
    writeField(out, ctx.blockHash());
    writeOptional(out, ctx.intentDigest());
    writeOptional(out, ctx.sessionPolicyDigest());
    log.trace("buildChallenge({})", ctx);
    return new ChallengeInput(ctx, out.toByteArray());
  }

  /**
   * Produces the VRF output and proof for the input.
   *
   * @param secretKey 32-byte VRF secret key
   * @param input     the challenge input
   * @return the vrf proof
   */
  public VrfProof evaluate(byte[] secretKey, ChallengeInput input) {
    BigInteger x = toScalar(secretKey);
    byte[] pi = vrf.prove(x, input.digest());
    return new VrfProof(vrf.proofToHash(pi), pi, vrf.publicKey(x));
  }

  /**
   * Verifies the proof against the public key and input.
   *
   * @param publicKey compressed public key
   * @param input     the challenge input
   * @param proof     the candidate proof
   * @return the VRF output
   * @throws InvalidProofException if the proof does not verify or its output does not match
   */
  public byte[] verify(byte[] publicKey, ChallengeInput input, VrfProof proof) {
    byte[] output = vrf.verify(publicKey, proof.proof(), input.digest());
    if (proof.output() == null || !MessageDigest.isEqual(output, proof.output())) {
      throw new InvalidProofException("VRF output does not match proof");
    }
    return output;
  }

  /**
   * Compressed public key for a secret key.
   *
   * @param secretKey the secret key
   * @return the public key
   */
  public byte[] publicKey(byte[] secretKey) {
    return vrf.publicKey(toScalar(secretKey));
  }

  /**
   * Wraps an existing secret key.
   *
   * @param secretKey the secret key
   * @return the vrf key pair
   */
  public VrfKeyPair keyPairFromSecret(byte[] secretKey) {
    return new VrfKeyPair(secretKey.clone(), publicKey(secretKey));
  }

  /**
   * Deterministically derives a key pair from seed material: {@code x = (seed mod (n-1)) + 1}.
   * Seeds should carry at least 128 bits more than the group order to keep the bias negligible.
   *
   * @param seed the seed
   * @return the vrf key pair
   */
  public VrfKeyPair keyPairFromSeed(byte[] seed) {
    if (seed == null || seed.length < curve.scalarLength()) {
      throw new IllegalArgumentException("Seed must be at least " + curve.scalarLength() + " bytes");
    }
    BigInteger x = new BigInteger(1, seed).mod(curve.n().subtract(BigInteger.ONE)).add(BigInteger.ONE);
    byte[] secretKey = ByteUtils.toFixedLength(x, curve.scalarLength());
    return new VrfKeyPair(secretKey, vrf.publicKey(x));
  }

  private BigInteger toScalar(byte[] secretKey) {
    if (secretKey == null || secretKey.length != curve.scalarLength()) {
      throw new IllegalArgumentException("VRF secret key must be " + curve.scalarLength() + " bytes");
    }
    BigInteger x = new BigInteger(1, secretKey);
    if (x.signum() == 0 || x.compareTo(curve.n()) >= 0) {
      throw new IllegalArgumentException("VRF secret key out of range");
    }
    return x;
  }

  private static void writeField(ByteArrayOutputStream out, byte[] value) {
    out.writeBytes(ByteUtils.I2OSP(value.length, 4));
    out.writeBytes(value);
  }

  private static void writeOptional(ByteArrayOutputStream out, byte[] digest) {
    if (digest == null) {
      out.write(0);
    } else {
      out.write(1);
      out.writeBytes(digest);
    }
  }
}
