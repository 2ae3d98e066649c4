package com.codeheadsystems.latchkey.client.exceptions;

/**
 * The authentication ceremony was aborted, timed out, or did not confirm presence. Nothing
 * was minted.
 */
public class CeremonyCancelledException extends RuntimeException {

  /**
   * Instantiates a new Ceremony cancelled exception.
   *
   * @param message the message
   */
  public CeremonyCancelledException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ceremony cancelled exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CeremonyCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
