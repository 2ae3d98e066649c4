package com.codeheadsystems.latchkey.shamir;

import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperator side of the three-pass exchange: applies and removes its persistent lock and
 * manages key rotation with a bounded, time-boxed grace list.
 * <p>
 * The ring is an immutable snapshot swapped atomically, so a lock removal resolves its key id
 * against exactly one ring and either succeeds with that key or fails. Mutations are
 * serialized and persisted before they become visible.
 */
public class CooperatorKeyManager implements LockCooperator {

  private static final Logger log = LoggerFactory.getLogger(CooperatorKeyManager.class);

  private final CommutativeCipher cipher;
  private final KeyRingStore keyRingStore;
  private final GracePolicy gracePolicy;
  private final Clock clock;
  private final AtomicReference<CooperatorKeyRing> ring = new AtomicReference<>();

  /**
   * Loads the stored ring, or generates and saves a first key when the store is empty.
   *
   * @param cipher       the cipher
   * @param keyRingStore the key ring store
   * @param gracePolicy  the grace policy
   * @param clock        the clock
   */
  public CooperatorKeyManager(final CommutativeCipher cipher,
                              final KeyRingStore keyRingStore,
                              final GracePolicy gracePolicy,
                              final Clock clock) {
    this.cipher = cipher;
    this.keyRingStore = keyRingStore;
    this.gracePolicy = gracePolicy;
    this.clock = clock;
    CooperatorKeyRing initial = keyRingStore.load().orElse(null);
    if (initial == null) {
      initial = new CooperatorKeyRing(generateKeypair());
      keyRingStore.save(initial);
      log.info("Generated initial cooperator key keyId={}", initial.current().keyId());
    } else if (!initial.current().modulus().equals(cipher.modulus())) {
      throw new IllegalStateException("Stored key ring was generated for a different modulus");
    }
    ring.set(initial);
    log.info("CooperatorKeyManager(currentKeyId={}, graceKeys={}, policy={})",
        initial.current().keyId(), initial.grace().size(), gracePolicy);
  }

  @Override
  public LockedValue applyLock(BigInteger blindedValue) {
    ServerKeypair current = ring.get().current();
    log.trace("applyLock(keyId={})", current.keyId());
    return new LockedValue(cipher.addLock(blindedValue, current.encryptExponent()), current.keyId());
  }

  @Override
  public BigInteger removeLock(BigInteger blindedValue, String keyId) {
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: keyId");
    }
    CooperatorKeyRing snapshot = ring.get();
    ServerKeypair keypair = snapshot.find(keyId, gracePolicy, clock.instant())
        .orElseThrow(() -> {
          log.debug("removeLock rejected unknown keyId={}", keyId);
          return new UnknownKeyIdException(keyId);
        });
    log.trace("removeLock(keyId={}, current={})", keyId, keypair == snapshot.current());
    return cipher.removeLock(blindedValue, keypair.decryptExponent());
  }

  @Override
  public CooperatorKeyInfo keyInfo() {
    CooperatorKeyRing snapshot = ring.get().pruned(gracePolicy, clock.instant());
    return new CooperatorKeyInfo(snapshot.current().keyId(), cipher.modulus(), snapshot.graceKeyIds());
  }

  /**
   * Generates a new current key. When {@code keepInGrace} is set the previous key keeps
   * removing locks until it ages out or is pushed off the grace list.
   *
   * @param keepInGrace whether to demote the previous key into the grace list
   * @return the rotation result
   */
  public synchronized RotationResult rotate(boolean keepInGrace) {
    Instant now = clock.instant();
    CooperatorKeyRing before = ring.get();
    CooperatorKeyRing after = before.rotate(generateKeypair(), keepInGrace, now).pruned(gracePolicy, now);
    publish(after);
    log.info("rotate(keepInGrace={}) {} -> {}, grace={}", keepInGrace,
        before.current().keyId(), after.current().keyId(), after.graceKeyIds());
    return new RotationResult(after.current().keyId(), before.current().keyId(), after.graceKeyIds());
  }

  /**
   * Drops a key from the grace list immediately.
   *
   * @param keyId the key id
   * @return true if the key was on the grace list
   */
  public synchronized boolean removeGraceKey(String keyId) {
    CooperatorKeyRing before = ring.get();
    if (!before.graceKeyIds().contains(keyId)) {
      return false;
    }
    publish(before.withoutGraceKey(keyId));
    log.info("removeGraceKey(keyId={})", keyId);
    return true;
  }

  /**
   * Removes expired grace keys and applies the size bound.
   *
   * @return how many keys were dropped
   */
  public synchronized int pruneGraceKeys() {
    CooperatorKeyRing before = ring.get();
    CooperatorKeyRing after = before.pruned(gracePolicy, clock.instant());
    int dropped = before.grace().size() - after.grace().size();
    if (dropped > 0) {
      publish(after);
      log.info("pruneGraceKeys() dropped {}", dropped);
    }
    return dropped;
  }

  /**
   * Current key id.
   *
   * @return the string
   */
  public String currentKeyId() {
    return ring.get().current().keyId();
  }

  /**
   * Current snapshot, for health checks and persistence tooling.
   *
   * @return the cooperator key ring
   */
  public CooperatorKeyRing keyRing() {
    return ring.get();
  }

  private void publish(CooperatorKeyRing next) {
    keyRingStore.save(next);
    ring.set(next);
  }

  private ServerKeypair generateKeypair() {
    LockKeys keys = cipher.generateLockKeys();
    return new ServerKeypair(keys.encryptExponent(), keys.decryptExponent(), cipher.modulus(),
        cipher.keyId(keys.encryptExponent()), clock.instant());
  }
}
