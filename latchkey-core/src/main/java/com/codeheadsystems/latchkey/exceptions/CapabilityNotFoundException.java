package com.codeheadsystems.latchkey.exceptions;

/**
 * No capability was minted for the session, or it was cleared.
 */
public class CapabilityNotFoundException extends CapabilityUnavailableException {

  /**
   * Instantiates a new exception.
   *
   * @param sessionId the session id
   */
  public CapabilityNotFoundException(final String sessionId) {
    super("No session capability", sessionId);
  }
}
