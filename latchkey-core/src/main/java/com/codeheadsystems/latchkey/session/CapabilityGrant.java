package com.codeheadsystems.latchkey.session;

import com.codeheadsystems.latchkey.common.ByteUtils;
import javax.security.auth.Destroyable;

/**
 * What a dispense hands to a signing unit: the wrap key seed and the salt needed to derive the
 * decryption key. Each grant owns private copies of both arrays.
 */
public final class CapabilityGrant implements Destroyable {

  private final String sessionId;
  private final byte[] wrapKeySeed;
  private final byte[] wrapKeySalt;
  private volatile boolean destroyed;

  /**
   * Instantiates a new Capability grant. The arrays are copied.
   *
   * @param sessionId   the session id
   * @param wrapKeySeed the wrap key seed
   * @param wrapKeySalt the wrap key salt
   */
  public CapabilityGrant(String sessionId, byte[] wrapKeySeed, byte[] wrapKeySalt) {
    this.sessionId = sessionId;
    this.wrapKeySeed = wrapKeySeed.clone();
    this.wrapKeySalt = wrapKeySalt.clone();
  }

  /**
   * Session id.
   *
   * @return the session id
   */
  public String sessionId() {
    return sessionId;
  }

  /**
   * Wrap key seed.
   *
   * @return the seed, not a copy
   */
  public byte[] wrapKeySeed() {
    checkDestroyed();
    return wrapKeySeed;
  }

  /**
   * Wrap key salt.
   *
   * @return the salt, not a copy
   */
  public byte[] wrapKeySalt() {
    checkDestroyed();
    return wrapKeySalt;
  }

  @Override
  public void destroy() {
    destroyed = true;
    ByteUtils.zeroize(wrapKeySeed, wrapKeySalt);
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  private void checkDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Grant has been destroyed");
    }
  }

  @Override
  public String toString() {
    return "CapabilityGrant[sessionId=" + sessionId + ", destroyed=" + destroyed + "]";
  }
}
