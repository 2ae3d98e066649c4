package com.codeheadsystems.latchkey.exceptions;

/**
 * Thrown when the decrypted signing key fails its integrity check. Signals tampering or wrong
 * key material and must never be retried silently.
 */
public class DerivationMismatchException extends RuntimeException {

  /**
   * Instantiates a new Derivation mismatch exception.
   *
   * @param message the message
   */
  public DerivationMismatchException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Derivation mismatch exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DerivationMismatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
