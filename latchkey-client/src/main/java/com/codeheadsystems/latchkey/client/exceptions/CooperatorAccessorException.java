package com.codeheadsystems.latchkey.client.exceptions;

/**
 * Network or HTTP failure talking to the remote cooperator.
 */
public class CooperatorAccessorException extends RuntimeException {
  /**
   * Instantiates a new Cooperator accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CooperatorAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
