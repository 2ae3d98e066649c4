package com.codeheadsystems.latchkey.shamir;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One of the cooperator's persistent lock keys.
 *
 * @param encryptExponent the encrypt exponent
 * @param decryptExponent the decrypt exponent
 * @param modulus         the shared prime
 * @param keyId           {@code base64url(SHA-256(encryptExponent))}
 * @param createdAt       when the key was generated
 */
public record ServerKeypair(BigInteger encryptExponent,
                            BigInteger decryptExponent,
                            BigInteger modulus,
                            String keyId,
                            Instant createdAt) {

  @Override
  public String toString() {
    return "ServerKeypair[keyId=" + keyId + ", createdAt=" + createdAt + "]";
  }
}
