package com.codeheadsystems.latchkey.vrf;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Canonical, domain-separated encoding of a {@link ChallengeContext}. Never persisted.
 */
public final class ChallengeInput {

  private final ChallengeContext context;
  private final byte[] encoded;

  ChallengeInput(ChallengeContext context, byte[] encoded) {
    this.context = context;
    this.encoded = encoded;
  }

  /**
   * The context this input was built from.
   *
   * @return the context
   */
  public ChallengeContext context() {
    return context;
  }

  /**
   * The canonical encoding.
   *
   * @return a copy of the encoded bytes
   */
  public byte[] encoded() {
    return encoded.clone();
  }

  /**
   * SHA-256 of the canonical encoding. This is the VRF alpha string.
   *
   * @return the digest
   */
  public byte[] digest() {
    try {
      return MessageDigest.getInstance("SHA-256").digest(encoded);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Block height the challenge is bound to.
   *
   * @return the block height
   */
  public long blockHeight() {
    return context.blockHeight();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChallengeInput that && MessageDigest.isEqual(encoded, that.encoded);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(encoded);
  }

  @Override
  public String toString() {
    return "ChallengeInput[" + context + "]";
  }
}
