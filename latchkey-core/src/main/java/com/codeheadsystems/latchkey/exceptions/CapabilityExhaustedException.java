package com.codeheadsystems.latchkey.exceptions;

/**
 * The capability has fewer remaining uses than requested.
 */
public class CapabilityExhaustedException extends CapabilityUnavailableException {

  /**
   * Instantiates a new exception.
   *
   * @param sessionId the session id
   */
  public CapabilityExhaustedException(final String sessionId) {
    super("Session capability exhausted", sessionId);
  }
}
