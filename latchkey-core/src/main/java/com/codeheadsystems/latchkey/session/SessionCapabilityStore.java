package com.codeheadsystems.latchkey.session;

import com.codeheadsystems.latchkey.channel.OneTimeChannel;
import com.codeheadsystems.latchkey.exceptions.CapabilityExhaustedException;
import com.codeheadsystems.latchkey.exceptions.CapabilityExpiredException;
import com.codeheadsystems.latchkey.exceptions.CapabilityNotFoundException;
import java.time.Duration;
import java.util.Optional;

/**
 * Time- and use-budgeted cache of wrap key seeds, keyed by session id. Holds neither the
 * long-term secret nor any decryption key.
 */
public interface SessionCapabilityStore {

  /**
   * Stores a capability, replacing any existing one for the session.
   *
   * @param sessionId   the session id
   * @param wrapKeySeed the wrap key seed, copied
   * @param wrapKeySalt the wrap key salt, copied
   * @param ttl         time to live, positive
   * @param maxUses     number of dispenses allowed, at least 1
   */
  void mint(String sessionId, byte[] wrapKeySeed, byte[] wrapKeySalt, Duration ttl, int maxUses);

  /**
   * Atomically checks expiry and budget, decrements, and delivers a grant into the channel.
   *
   * @param sessionId the session id
   * @param uses      uses to consume, at least 1
   * @param channel   a fresh, unused sender
   * @throws CapabilityNotFoundException  if nothing is minted for the session
   * @throws CapabilityExpiredException   if the ttl has elapsed
   * @throws CapabilityExhaustedException if fewer than {@code uses} remain
   */
  void dispense(String sessionId, int uses, OneTimeChannel.Sender<CapabilityGrant> channel);

  /**
   * Dispenses into a newly created channel and returns its receiving end.
   *
   * @param sessionId the session id
   * @param uses      uses to consume
   * @return the receiver holding the grant
   */
  default OneTimeChannel.Receiver<CapabilityGrant> dispense(String sessionId, int uses) {
    OneTimeChannel<CapabilityGrant> channel = OneTimeChannel.create();
    dispense(sessionId, uses, channel.sender());
    return channel.receiver();
  }

  /**
   * Non-secret status of a live capability.
   *
   * @param sessionId the session id
   * @return the status, empty if none or expired
   */
  Optional<CapabilityStatus> status(String sessionId);

  /**
   * Destroys the capability for one session.
   *
   * @param sessionId the session id
   */
  void clear(String sessionId);

  /**
   * Destroys every capability, e.g. on logout.
   */
  void clearAll();
}
