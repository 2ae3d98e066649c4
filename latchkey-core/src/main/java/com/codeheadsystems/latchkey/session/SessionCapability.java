package com.codeheadsystems.latchkey.session;

import com.codeheadsystems.latchkey.common.ByteUtils;
import java.time.Duration;
import java.time.Instant;

/**
 * A minted capability as held by the store. Only the store ever sees instances of this type.
 *
 * @param sessionId     the session id
 * @param wrapKeySeed   the wrap key seed
 * @param wrapKeySalt   the wrap key salt
 * @param ttl           time to live from mint
 * @param remainingUses dispenses left, never negative
 * @param mintedAt      when it was minted
 */
record SessionCapability(String sessionId,
                         byte[] wrapKeySeed,
                         byte[] wrapKeySalt,
                         Duration ttl,
                         int remainingUses,
                         Instant mintedAt) {

  SessionCapability {
    if (remainingUses < 0) {
      throw new IllegalStateException("remainingUses must not be negative");
    }
  }

  Instant expiresAt() {
    return mintedAt.plus(ttl);
  }

  boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt());
  }

  SessionCapability consume(int uses) {
    return new SessionCapability(sessionId, wrapKeySeed, wrapKeySalt, ttl, remainingUses - uses, mintedAt);
  }

  CapabilityGrant grant() {
    return new CapabilityGrant(sessionId, wrapKeySeed, wrapKeySalt);
  }

  void wipe() {
    ByteUtils.zeroize(wrapKeySeed, wrapKeySalt);
  }

  @Override
  public String toString() {
    return "SessionCapability[sessionId=" + sessionId + ", remainingUses=" + remainingUses
        + ", expiresAt=" + expiresAt() + "]";
  }
}
