package com.codeheadsystems.latchkey.shamir;

import java.time.Instant;

/**
 * A retired key that still accepts lock removal.
 *
 * @param keypair   the keypair
 * @param retiredAt when it stopped being current
 */
public record GraceKey(ServerKeypair keypair, Instant retiredAt) {
}
