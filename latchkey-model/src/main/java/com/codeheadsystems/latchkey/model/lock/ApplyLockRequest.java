package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * First pass sent to the cooperator: the KEK under the client's lock only.
 * <p>
 * Used by: {@code POST /lock/apply}
 *
 * @param blindedValue base64url (no padding) fixed-width encoding of {@code KEK^c mod p}
 */
public record ApplyLockRequest(@JsonProperty("blindedValue") String blindedValue) {
}
