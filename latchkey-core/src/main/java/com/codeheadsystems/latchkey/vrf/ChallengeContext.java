package com.codeheadsystems.latchkey.vrf;

import java.util.Arrays;
import java.util.Objects;

/**
 * Caller-supplied inputs for a VRF challenge. The block reference must come from the ledger
 * and be fresh; the verifier, not the engine, enforces the freshness window.
 *
 * @param domainSeparator     fixed per-deployment label, e.g. {@code "latchkey/vrf/v1"}
 * @param userId              account identifier
 * @param rpId                relying-party identifier, lowercased during encoding
 * @param blockHeight         block height, non-negative
 * @param blockHash           block hash bytes
 * @param intentDigest        optional 32-byte digest of the intent being authorized, may be null
 * @param sessionPolicyDigest optional 32-byte digest of the session policy, may be null
 */
public record ChallengeContext(String domainSeparator,
                               String userId,
                               String rpId,
                               long blockHeight,
                               byte[] blockHash,
                               byte[] intentDigest,
                               byte[] sessionPolicyDigest) {

  /**
   * Required length of the optional digests.
   */
  public static final int DIGEST_LENGTH = 32;

  /**
   * Validates the context.
   */
  public ChallengeContext {
    requireText(domainSeparator, "domainSeparator");
    requireText(userId, "userId");
    requireText(rpId, "rpId");
    if (blockHeight < 0) {
      throw new IllegalArgumentException("blockHeight must be non-negative: " + blockHeight);
    }
    if (blockHash == null || blockHash.length == 0) {
      throw new IllegalArgumentException("Missing required field: blockHash");
    }
    requireDigest(intentDigest, "intentDigest");
    requireDigest(sessionPolicyDigest, "sessionPolicyDigest");
  }

  /**
   * Context without intent or policy digests.
   *
   * @param domainSeparator the domain separator
   * @param userId          the user id
   * @param rpId            the rp id
   * @param blockHeight     the block height
   * @param blockHash       the block hash
   */
  public ChallengeContext(String domainSeparator, String userId, String rpId, long blockHeight, byte[] blockHash) {
    this(domainSeparator, userId, rpId, blockHeight, blockHash, null, null);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }

  private static void requireDigest(byte[] digest, String name) {
    if (digest != null && digest.length != DIGEST_LENGTH) {
      throw new IllegalArgumentException(name + " must be " + DIGEST_LENGTH + " bytes");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChallengeContext that)) {
      return false;
    }
    return blockHeight == that.blockHeight
        && domainSeparator.equals(that.domainSeparator)
        && userId.equals(that.userId)
        && rpId.equals(that.rpId)
        && Arrays.equals(blockHash, that.blockHash)
        && Arrays.equals(intentDigest, that.intentDigest)
        && Arrays.equals(sessionPolicyDigest, that.sessionPolicyDigest);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(domainSeparator, userId, rpId, blockHeight);
    result = 31 * result + Arrays.hashCode(blockHash);
    result = 31 * result + Arrays.hashCode(intentDigest);
    return 31 * result + Arrays.hashCode(sessionPolicyDigest);
  }

  @Override
  public String toString() {
    return "ChallengeContext[userId=" + userId + ", rpId=" + rpId + ", blockHeight=" + blockHeight + "]";
  }
}
