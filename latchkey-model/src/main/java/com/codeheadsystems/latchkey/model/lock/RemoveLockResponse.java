package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The value with the cooperator's lock removed.
 *
 * @param value base64url encoding of {@code KEK^t mod p}
 */
public record RemoveLockResponse(@JsonProperty("value") String value) {
}
