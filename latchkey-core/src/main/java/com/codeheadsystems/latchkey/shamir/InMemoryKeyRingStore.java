package com.codeheadsystems.latchkey.shamir;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link KeyRingStore}. Every lock made against a ring held here becomes
 * unrecoverable through the cooperator after a restart. Suitable for development and tests only.
 */
public class InMemoryKeyRingStore implements KeyRingStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyRingStore.class);

  private final AtomicReference<CooperatorKeyRing> ring = new AtomicReference<>();

  /**
   * Instantiates a new In memory key ring store.
   */
  public InMemoryKeyRingStore() {
    log.warn("InMemoryKeyRingStore in use: cooperator keys are lost on restart");
  }

  @Override
  public Optional<CooperatorKeyRing> load() {
    return Optional.ofNullable(ring.get());
  }

  @Override
  public void save(CooperatorKeyRing keyRing) {
    ring.set(keyRing);
    log.debug("Saved key ring currentKeyId={}", keyRing.current().keyId());
  }
}
