package com.codeheadsystems.latchkey.exceptions;

/**
 * Thrown by the cooperator when a lock-removal request names a key id that is neither the
 * current key nor on the grace list.
 */
public class UnknownKeyIdException extends RuntimeException {

  private final String keyId;

  /**
   * Instantiates a new Unknown key id exception.
   *
   * @param keyId the key id that was presented
   */
  public UnknownKeyIdException(final String keyId) {
    super("Unknown cooperator key id: " + keyId);
    this.keyId = keyId;
  }

  /**
   * The key id that was presented.
   *
   * @return the key id
   */
  public String keyId() {
    return keyId;
  }
}
