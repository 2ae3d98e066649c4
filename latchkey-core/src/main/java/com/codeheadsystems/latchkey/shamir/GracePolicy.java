package com.codeheadsystems.latchkey.shamir;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounds on the grace list.
 *
 * @param maxGraceKeys maximum number of retired keys kept, 0 disables the grace list
 * @param maxGraceAge  how long a retired key keeps working after retirement
 */
public record GracePolicy(int maxGraceKeys, Duration maxGraceAge) {

  /**
   * Five keys for up to thirty days.
   */
  public static final GracePolicy DEFAULT = new GracePolicy(5, Duration.ofDays(30));

  /**
   * Validates the policy.
   */
  public GracePolicy {
    if (maxGraceKeys < 0) {
      throw new IllegalArgumentException("maxGraceKeys must be non-negative");
    }
    if (maxGraceAge == null || maxGraceAge.isNegative()) {
      throw new IllegalArgumentException("maxGraceAge must be a non-negative duration");
    }
  }

  /**
   * Whether the grace key is past its age bound.
   *
   * @param graceKey the grace key
   * @param now      the now
   * @return true if expired
   */
  public boolean isExpired(GraceKey graceKey, Instant now) {
    return !now.isBefore(graceKey.retiredAt().plus(maxGraceAge));
  }
}
