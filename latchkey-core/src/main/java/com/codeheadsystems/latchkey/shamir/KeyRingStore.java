package com.codeheadsystems.latchkey.shamir;

import java.util.Optional;

/**
 * Durable storage for the cooperator's key ring. Implementations replace the stored ring
 * wholesale on every save.
 */
public interface KeyRingStore {

  /**
   * Loads the stored ring.
   *
   * @return the ring, or empty when none has been saved
   */
  Optional<CooperatorKeyRing> load();

  /**
   * Replaces the stored ring.
   *
   * @param ring the ring
   */
  void save(CooperatorKeyRing ring);
}
