package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cooperator's reply to {@link ApplyLockRequest}.
 *
 * @param doubleBlindedValue base64url encoding of {@code KEK^cs mod p}
 * @param keyId              the cooperator key that applied the lock; the client stores it
 *                           and sends it back on every unlock
 */
public record ApplyLockResponse(@JsonProperty("doubleBlindedValue") String doubleBlindedValue,
                                @JsonProperty("keyId") String keyId) {
}
