package com.codeheadsystems.latchkey.exceptions;

/**
 * The capability's time-to-live elapsed before the dispense.
 */
public class CapabilityExpiredException extends CapabilityUnavailableException {

  /**
   * Instantiates a new exception.
   *
   * @param sessionId the session id
   */
  public CapabilityExpiredException(final String sessionId) {
    super("Session capability expired", sessionId);
  }
}
