package com.codeheadsystems.latchkey.client.ceremony;

import com.codeheadsystems.latchkey.common.ByteUtils;
import java.util.Optional;
import javax.security.auth.Destroyable;

/**
 * Outcome of one authentication ceremony. The primary secret is a stable per-credential value
 * (for example a PRF output), so the same account always derives the same pass factor. The
 * secondary secret is only requested for registration and recovery.
 */
public final class CeremonyResult implements Destroyable {

  private final boolean presenceConfirmed;
  private final byte[] primarySecret;
  private final byte[] secondarySecret;
  private volatile boolean destroyed;

  /**
   * Instantiates a new Ceremony result. Arrays are copied.
   *
   * @param presenceConfirmed whether the user was present
   * @param primarySecret     the primary secret
   * @param secondarySecret   the secondary secret, may be null
   */
  public CeremonyResult(boolean presenceConfirmed, byte[] primarySecret, byte[] secondarySecret) {
    this.presenceConfirmed = presenceConfirmed;
    this.primarySecret = ByteUtils.copy(primarySecret);
    this.secondarySecret = ByteUtils.copy(secondarySecret);
  }

  public boolean presenceConfirmed() {
    return presenceConfirmed;
  }

  /**
   * Primary secret.
   *
   * @return the secret, not a copy
   */
  public byte[] primarySecret() {
    checkDestroyed();
    return primarySecret;
  }

  /**
   * Secondary secret, if the ceremony produced one.
   *
   * @return the secret, not a copy
   */
  public Optional<byte[]> secondarySecret() {
    checkDestroyed();
    return Optional.ofNullable(secondarySecret);
  }

  @Override
  public void destroy() {
    destroyed = true;
    ByteUtils.zeroize(primarySecret, secondarySecret);
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  private void checkDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Ceremony result has been destroyed");
    }
  }
}
