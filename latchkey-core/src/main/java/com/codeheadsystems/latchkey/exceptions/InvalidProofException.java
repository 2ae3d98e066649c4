package com.codeheadsystems.latchkey.exceptions;

/**
 * Thrown when a VRF proof fails verification, or when a verified challenge is stale or does not
 * match the challenge observed by the verifier. Fatal for the ceremony that produced it.
 */
public class InvalidProofException extends RuntimeException {

  /**
   * Instantiates a new Invalid proof exception.
   *
   * @param message the message
   */
  public InvalidProofException(final String message) {
    super(message);
  }
}
