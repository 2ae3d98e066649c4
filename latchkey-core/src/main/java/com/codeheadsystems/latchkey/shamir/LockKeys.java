package com.codeheadsystems.latchkey.shamir;

import java.math.BigInteger;

/**
 * An encrypt/decrypt exponent pair with {@code e*d = 1 mod (p-1)}.
 *
 * @param encryptExponent the encrypt exponent
 * @param decryptExponent the decrypt exponent
 */
public record LockKeys(BigInteger encryptExponent, BigInteger decryptExponent) {

  @Override
  public String toString() {
    return "LockKeys[redacted]";
  }
}
