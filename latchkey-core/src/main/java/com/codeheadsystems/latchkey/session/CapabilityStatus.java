package com.codeheadsystems.latchkey.session;

import java.time.Instant;

/**
 * Non-secret view of a capability.
 *
 * @param sessionId     the session id
 * @param remainingUses the remaining uses
 * @param expiresAt     the expiry
 */
public record CapabilityStatus(String sessionId, int remainingUses, Instant expiresAt) {
}
