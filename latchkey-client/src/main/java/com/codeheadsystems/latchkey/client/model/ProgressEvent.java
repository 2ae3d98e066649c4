package com.codeheadsystems.latchkey.client.model;

import java.time.Instant;

/**
 * A step the orchestrator reached. {@link Phase#RECOVERY_PROMPT} and
 * {@link Phase#COLD_PATH_REQUIRED} tell a UI that an extra prompt is coming.
 *
 * @param phase     the phase
 * @param accountId the account
 * @param sessionId the session, null during registration
 * @param at        when it happened
 */
public record ProgressEvent(Phase phase, String accountId, String sessionId, Instant at) {

  /**
   * Progress phases.
   */
  public enum Phase {
    CHALLENGE_ISSUED,
    COOPERATOR_UNLOCK,
    RECOVERY_PROMPT,
    REWRAPPED,
    SESSION_MINTED,
    COLD_PATH_REQUIRED,
    SIGNED
  }
}
