package com.codeheadsystems.latchkey.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyRing;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import com.codeheadsystems.latchkey.shamir.ServerKeypair;
import java.math.BigInteger;

/**
 * Health check that verifies the current cooperator key is usable: it belongs to the
 * configured modulus and its exponents invert each other.
 */
public class CooperatorKeyRingHealthCheck extends HealthCheck {

  /**
   * Registered name.
   */
  public static final String NAME = "cooperator-key-ring";

  private static final BigInteger PROBE = BigInteger.valueOf(0x1a7c4e7L);

  private final CooperatorKeyManager keyManager;
  private final CommutativeCipher cipher;

  /**
   * Instantiates a new Cooperator key ring health check.
   *
   * @param keyManager the key manager
   * @param cipher     the cipher
   */
  public CooperatorKeyRingHealthCheck(CooperatorKeyManager keyManager, CommutativeCipher cipher) {
    this.keyManager = keyManager;
    this.cipher = cipher;
  }

  @Override
  protected Result check() {
    CooperatorKeyRing ring = keyManager.keyRing();
    ServerKeypair current = ring.current();
    if (!cipher.modulus().equals(current.modulus())) {
      return Result.unhealthy("Current key %s was generated for a different modulus", current.keyId());
    }
    BigInteger locked = cipher.addLock(PROBE, current.encryptExponent());
    if (!PROBE.equals(cipher.removeLock(locked, current.decryptExponent()))) {
      return Result.unhealthy("Current key %s does not round-trip", current.keyId());
    }
    return Result.healthy("currentKeyId=%s graceKeys=%d", current.keyId(), ring.grace().size());
  }
}
