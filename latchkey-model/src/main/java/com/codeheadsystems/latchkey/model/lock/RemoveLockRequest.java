package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unlock pass: the stored server-locked KEK with a fresh client lock on top.
 * <p>
 * Used by: {@code POST /lock/remove}
 *
 * @param blindedValue base64url encoding of {@code KEK^st mod p}
 * @param keyId        key id recorded at registration
 */
public record RemoveLockRequest(@JsonProperty("blindedValue") String blindedValue,
                                @JsonProperty("keyId") String keyId) {
}
