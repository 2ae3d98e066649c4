package com.codeheadsystems.latchkey.client.model;

import com.codeheadsystems.latchkey.shamir.WrappedSecretBlob;
import com.codeheadsystems.latchkey.signer.EncryptedSigningKey;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Everything persisted for one account. Always written as a whole.
 *
 * @param accountId    the account id
 * @param blob         the wrapped long-term secret; null when the cooperator was unreachable at
 *                     registration, in which case unlocks go through recovery
 * @param wrapKeySalt  per-account salt for the final derivation step
 * @param vrfPublicKey the account's VRF public key
 * @param signingKey   the sealed signing key
 * @param updatedAt    last write
 */
public record AccountRecord(String accountId,
                            WrappedSecretBlob blob,
                            byte[] wrapKeySalt,
                            byte[] vrfPublicKey,
                            EncryptedSigningKey signingKey,
                            Instant updatedAt) {

  /**
   * Instantiates a new Account record.
   *
   * @param accountId    the account id
   * @param blob         the blob
   * @param wrapKeySalt  the wrap key salt
   * @param vrfPublicKey the vrf public key
   * @param signingKey   the signing key
   * @param updatedAt    the updated at
   */
  public AccountRecord {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: accountId");
    }
    if (wrapKeySalt == null || wrapKeySalt.length == 0) {
      throw new IllegalArgumentException("Missing required field: wrapKeySalt");
    }
    if (vrfPublicKey == null || signingKey == null || updatedAt == null) {
      throw new IllegalArgumentException("vrfPublicKey, signingKey and updatedAt are required");
    }
  }

  /**
   * Copy with a replacement blob.
   *
   * @param newBlob the new blob
   * @param now     the write time
   * @return the account record
   */
  public AccountRecord withBlob(WrappedSecretBlob newBlob, Instant now) {
    return new AccountRecord(accountId, newBlob, wrapKeySalt, vrfPublicKey, signingKey, now);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AccountRecord that
        && accountId.equals(that.accountId)
        && Objects.equals(blob, that.blob)
        && Arrays.equals(wrapKeySalt, that.wrapKeySalt)
        && Arrays.equals(vrfPublicKey, that.vrfPublicKey)
        && signingKey.equals(that.signingKey)
        && updatedAt.equals(that.updatedAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(accountId, blob, signingKey, updatedAt);
    result = 31 * result + Arrays.hashCode(wrapKeySalt);
    return 31 * result + Arrays.hashCode(vrfPublicKey);
  }

  @Override
  public String toString() {
    return "AccountRecord[accountId=" + accountId + ", blob=" + blob + ", updatedAt=" + updatedAt + "]";
  }
}
