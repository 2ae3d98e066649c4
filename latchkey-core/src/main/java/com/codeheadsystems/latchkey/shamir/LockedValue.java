package com.codeheadsystems.latchkey.shamir;

import java.math.BigInteger;

/**
 * Result of applying the cooperator's lock.
 *
 * @param value the double-locked value
 * @param keyId the key that applied the lock
 */
public record LockedValue(BigInteger value, String keyId) {
}
