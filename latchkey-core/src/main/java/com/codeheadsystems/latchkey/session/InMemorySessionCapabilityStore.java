package com.codeheadsystems.latchkey.session;

import com.codeheadsystems.latchkey.channel.OneTimeChannel;
import com.codeheadsystems.latchkey.exceptions.CapabilityExhaustedException;
import com.codeheadsystems.latchkey.exceptions.CapabilityExpiredException;
import com.codeheadsystems.latchkey.exceptions.CapabilityNotFoundException;
import com.codeheadsystems.latchkey.exceptions.CapabilityUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionCapabilityStore} backed by a {@link ConcurrentHashMap}. Each dispense runs as
 * one {@code compute} call, so check and decrement cannot interleave for a session.
 * <p>
 * Expired and exhausted capabilities are not swept; the next dispense that hits one removes
 * and wipes it.
 */
public class InMemorySessionCapabilityStore implements SessionCapabilityStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionCapabilityStore.class);

  private final ConcurrentHashMap<String, SessionCapability> capabilities = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Instantiates a store on the system clock.
   */
  public InMemorySessionCapabilityStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new store.
   *
   * @param clock the clock
   */
  public InMemorySessionCapabilityStore(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public void mint(String sessionId, byte[] wrapKeySeed, byte[] wrapKeySalt, Duration ttl, int maxUses) {
    requireSessionId(sessionId);
    if (wrapKeySeed == null || wrapKeySeed.length == 0 || wrapKeySalt == null || wrapKeySalt.length == 0) {
      throw new IllegalArgumentException("wrapKeySeed and wrapKeySalt are required");
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (maxUses < 1) {
      throw new IllegalArgumentException("maxUses must be at least 1");
    }
    SessionCapability capability = new SessionCapability(sessionId, wrapKeySeed.clone(), wrapKeySalt.clone(),
        ttl, maxUses, clock.instant());
    SessionCapability previous = capabilities.put(sessionId, capability);
    if (previous != null) {
      previous.wipe();
    }
    log.debug("mint(sessionId={}, ttl={}, maxUses={})", sessionId, ttl, maxUses);
  }

  @Override
  public void dispense(String sessionId, int uses, OneTimeChannel.Sender<CapabilityGrant> channel) {
    requireSessionId(sessionId);
    if (uses < 1) {
      throw new IllegalArgumentException("uses must be at least 1");
    }
    if (channel == null || channel.isUsed()) {
      throw new IllegalArgumentException("A fresh channel is required");
    }
    Instant now = clock.instant();
    CapabilityGrant[] granted = new CapabilityGrant[1];
    CapabilityUnavailableException[] failure = new CapabilityUnavailableException[1];
    capabilities.compute(sessionId, (id, capability) -> {
      if (capability == null) {
        failure[0] = new CapabilityNotFoundException(id);
        return null;
      }
      if (capability.isExpired(now)) {
        failure[0] = new CapabilityExpiredException(id);
        capability.wipe();
        return null;
      }
      if (capability.remainingUses() < uses) {
        failure[0] = new CapabilityExhaustedException(id);
        if (capability.remainingUses() > 0) {
          return capability;
        }
        capability.wipe();
        return null;
      }
      granted[0] = capability.grant();
      return capability.consume(uses);
    });
    if (failure[0] != null) {
      log.debug("dispense(sessionId={}) failed: {}", sessionId, failure[0].getClass().getSimpleName());
      throw failure[0];
    }
    log.trace("dispense(sessionId={}, uses={})", sessionId, uses);
    channel.send(granted[0]);
  }

  @Override
  public Optional<CapabilityStatus> status(String sessionId) {
    SessionCapability capability = capabilities.get(sessionId);
    if (capability == null || capability.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(new CapabilityStatus(sessionId, capability.remainingUses(), capability.expiresAt()));
  }

  @Override
  public void clear(String sessionId) {
    SessionCapability removed = capabilities.remove(sessionId);
    if (removed != null) {
      removed.wipe();
      log.debug("clear(sessionId={})", sessionId);
    }
  }

  @Override
  public void clearAll() {
    capabilities.keySet().forEach(this::clear);
    log.debug("clearAll()");
  }

  private static void requireSessionId(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: sessionId");
    }
  }
}
