package com.codeheadsystems.latchkey.shamir;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * The long-term secret at rest: sealed under a KEK whose only stored form still carries the
 * cooperator's lock. Never holds plaintext.
 *
 * @param ciphertext        the secret sealed under the KEK
 * @param serverLockedValue the KEK with only the cooperator's lock applied
 * @param serverKeyId       the cooperator key that applied that lock
 * @param updatedAt         when this blob was produced
 */
public record WrappedSecretBlob(byte[] ciphertext,
                                byte[] serverLockedValue,
                                String serverKeyId,
                                Instant updatedAt) {

  @Override
  public boolean equals(Object o) {
    return o instanceof WrappedSecretBlob that
        && Arrays.equals(ciphertext, that.ciphertext)
        && Arrays.equals(serverLockedValue, that.serverLockedValue)
        && Objects.equals(serverKeyId, that.serverKeyId)
        && Objects.equals(updatedAt, that.updatedAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(serverKeyId, updatedAt);
    result = 31 * result + Arrays.hashCode(ciphertext);
    return 31 * result + Arrays.hashCode(serverLockedValue);
  }

  @Override
  public String toString() {
    return "WrappedSecretBlob[serverKeyId=" + serverKeyId + ", updatedAt=" + updatedAt + "]";
  }
}
