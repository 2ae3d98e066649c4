package com.codeheadsystems.latchkey.client.exceptions;

/**
 * The fallback recovery path could not reproduce the account's long-term secret.
 */
public class RecoveryFailedException extends RuntimeException {
  /**
   * Instantiates a new Recovery failed exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RecoveryFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
