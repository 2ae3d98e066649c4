package com.codeheadsystems.latchkey.exceptions;

/**
 * Base type for session-capability dispense failures. None of these are fatal: the caller
 * re-mints through the cold path.
 */
public abstract class CapabilityUnavailableException extends RuntimeException {

  private final String sessionId;

  /**
   * Instantiates a new Capability unavailable exception.
   *
   * @param message   the message
   * @param sessionId the session id
   */
  protected CapabilityUnavailableException(final String message, final String sessionId) {
    super(message + ": " + sessionId);
    this.sessionId = sessionId;
  }

  /**
   * Session id.
   *
   * @return the session id the dispense was attempted for
   */
  public String sessionId() {
    return sessionId;
  }
}
