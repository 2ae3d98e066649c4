package com.codeheadsystems.latchkey.common;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for lock exponents, KEKs, AEAD nonces and per-account salts.
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
    random.nextBytes(out);
    return out;
  }

  /**
   * Draws a uniformly random integer in {@code [0, bound)} by rejection sampling.
   *
   * @param bound exclusive upper bound, must be positive
   * @return the random integer
   */
  public BigInteger randomBelow(BigInteger bound) {
    if (bound.signum() <= 0) {
      throw new IllegalArgumentException("Bound must be positive");
    }
    BigInteger candidate;
    do {
      candidate = new BigInteger(bound.bitLength(), random);
    } while (candidate.compareTo(bound) >= 0);
    return candidate;
  }
}
