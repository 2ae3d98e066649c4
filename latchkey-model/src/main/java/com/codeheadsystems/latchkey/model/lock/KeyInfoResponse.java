package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Public view of the cooperator's key ring.
 * <p>
 * Used by: {@code GET /key-info}
 *
 * @param currentKeyId the key new registrations are locked under
 * @param modulus      the shared prime, base64url of its unsigned big-endian bytes
 * @param graceKeyIds  retired keys that still remove locks, newest first
 */
public record KeyInfoResponse(@JsonProperty("currentKeyId") String currentKeyId,
                              @JsonProperty("modulus") String modulus,
                              @JsonProperty("graceKeyIds") List<String> graceKeyIds) {
}
