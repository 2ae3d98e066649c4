package com.codeheadsystems.latchkey.shamir;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the cooperator's keys: the current key plus the grace list, newest first.
 *
 * @param current the current key, used for every new lock
 * @param grace   retired keys that still accept lock removal
 */
public record CooperatorKeyRing(ServerKeypair current, List<GraceKey> grace) {

  /**
   * Copies the grace list.
   */
  public CooperatorKeyRing {
    if (current == null) {
      throw new IllegalArgumentException("Key ring requires a current key");
    }
    grace = List.copyOf(grace);
  }

  /**
   * Ring with no grace keys.
   *
   * @param current the current
   */
  public CooperatorKeyRing(ServerKeypair current) {
    this(current, List.of());
  }

  /**
   * Exact key id lookup against the current key and the unexpired grace keys.
   *
   * @param keyId  the key id
   * @param policy the policy
   * @param now    the now
   * @return the keypair, if known
   */
  public Optional<ServerKeypair> find(String keyId, GracePolicy policy, Instant now) {
    if (current.keyId().equals(keyId)) {
      return Optional.of(current);
    }
    return grace.stream()
        .filter(g -> g.keypair().keyId().equals(keyId))
        .filter(g -> !policy.isExpired(g, now))
        .map(GraceKey::keypair)
        .findFirst();
  }

  /**
   * Key ids on the grace list, newest first.
   *
   * @return the grace key ids
   */
  public List<String> graceKeyIds() {
    return grace.stream().map(g -> g.keypair().keyId()).toList();
  }

  /**
   * Makes {@code next} current, optionally demoting the old current key to the head of the grace list.
   *
   * @param next        the next
   * @param keepInGrace the keep in grace
   * @param now         the now
   * @return the rotated ring
   */
  public CooperatorKeyRing rotate(ServerKeypair next, boolean keepInGrace, Instant now) {
    List<GraceKey> nextGrace = new ArrayList<>();
    if (keepInGrace) {
      nextGrace.add(new GraceKey(current, now));
    }
    nextGrace.addAll(grace);
    return new CooperatorKeyRing(next, nextGrace);
  }

  /**
   * Drops expired grace keys and trims the list to the size bound.
   *
   * @param policy the policy
   * @param now    the now
   * @return the pruned ring
   */
  public CooperatorKeyRing pruned(GracePolicy policy, Instant now) {
    List<GraceKey> kept = grace.stream()
        .filter(g -> !policy.isExpired(g, now))
        .limit(policy.maxGraceKeys())
        .toList();
    return new CooperatorKeyRing(current, kept);
  }

  /**
   * Ring without the named grace key.
   *
   * @param keyId the key id
   * @return the ring
   */
  public CooperatorKeyRing withoutGraceKey(String keyId) {
    return new CooperatorKeyRing(current,
        grace.stream().filter(g -> !g.keypair().keyId().equals(keyId)).toList());
  }
}
