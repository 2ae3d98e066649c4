package com.codeheadsystems.latchkey.shamir;

import java.math.BigInteger;
import java.util.List;

/**
 * Public view of the cooperator's key ring.
 *
 * @param currentKeyId the key id used for new locks
 * @param modulus      the shared prime
 * @param graceKeyIds  retired key ids still accepted for lock removal
 */
public record CooperatorKeyInfo(String currentKeyId, BigInteger modulus, List<String> graceKeyIds) {

  /**
   * Copies the grace ids.
   */
  public CooperatorKeyInfo {
    graceKeyIds = graceKeyIds == null ? List.of() : List.copyOf(graceKeyIds);
  }
}
