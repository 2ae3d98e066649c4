package com.codeheadsystems.latchkey.client.config;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;

/**
 * Budget for one warm session.
 *
 * @param ttl     how long the capability lives after minting
 * @param maxUses how many signatures it may back
 */
public record SessionPolicy(Duration ttl, int maxUses) {

  /**
   * Instantiates a new Session policy.
   *
   * @param ttl     the ttl
   * @param maxUses the max uses
   */
  public SessionPolicy {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (maxUses < 1) {
      throw new IllegalArgumentException("maxUses must be at least 1");
    }
  }

  /**
   * SHA-256 over the session id and this policy, bound into the VRF challenge so the ceremony
   * authorizes exactly this budget.
   *
   * @param sessionId the session id
   * @return 32-byte digest
   */
  public byte[] digest(String sessionId) {
    byte[] id = sessionId.getBytes(StandardCharsets.UTF_8);
    ByteBuffer buffer = ByteBuffer.allocate(4 + id.length + 8 + 4)
        .putInt(id.length)
        .put(id)
        .putLong(ttl.toMillis())
        .putInt(maxUses);
    try {
      return MessageDigest.getInstance("SHA-256").digest(buffer.array());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
