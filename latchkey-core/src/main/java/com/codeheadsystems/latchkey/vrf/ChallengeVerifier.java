package com.codeheadsystems.latchkey.vrf;

import com.codeheadsystems.latchkey.exceptions.InvalidProofException;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifier-side checks layered over {@link ChallengeEngine#verify}: the proof must be valid,
 * the block must fall inside the freshness window, and the output must equal the challenge
 * the verifier observed in the ceremony assertion.
 */
public class ChallengeVerifier {

  private static final Logger log = LoggerFactory.getLogger(ChallengeVerifier.class);

  private final ChallengeEngine engine;
  private final FreshnessOracle freshnessOracle;
  private final long maxBlockAge;

  /**
   * Instantiates a new Challenge verifier.
   *
   * @param engine          the engine
   * @param freshnessOracle source of the current block height
   * @param maxBlockAge     how many blocks old a challenge may be
   */
  public ChallengeVerifier(ChallengeEngine engine, FreshnessOracle freshnessOracle, long maxBlockAge) {
    if (maxBlockAge < 0) {
      throw new IllegalArgumentException("maxBlockAge must be non-negative");
    }
    this.engine = engine;
    this.freshnessOracle = freshnessOracle;
    this.maxBlockAge = maxBlockAge;
    log.info("ChallengeVerifier(maxBlockAge={})", maxBlockAge);
  }

  /**
   * Verifies proof, freshness and binding.
   *
   * @param publicKey          the account's VRF public key
   * @param input              the challenge input the client claims to have used
   * @param proof              the proof
   * @param observedChallenge  the challenge value carried by the ceremony assertion
   * @return the verified VRF output
   * @throws InvalidProofException on any failure
   */
  public byte[] verify(byte[] publicKey, ChallengeInput input, VrfProof proof, byte[] observedChallenge) {
    long current = freshnessOracle.latestBlock().height();
    long height = input.blockHeight();
    if (height > current) {
      throw new InvalidProofException("Challenge block " + height + " is ahead of the ledger at " + current);
    }
    if (current - height > maxBlockAge) {
      throw new InvalidProofException("Challenge block " + height + " is stale; ledger is at " + current);
    }
    byte[] output = engine.verify(publicKey, input, proof);
    if (observedChallenge == null || !MessageDigest.isEqual(output, observedChallenge)) {
      throw new InvalidProofException("Observed challenge does not match VRF output");
    }
    log.debug("verify(userId={}, blockHeight={}) passed", input.context().userId(), height);
    return output;
  }
}
