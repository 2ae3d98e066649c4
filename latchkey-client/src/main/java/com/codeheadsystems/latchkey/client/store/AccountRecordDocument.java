package com.codeheadsystems.latchkey.client.store;

import com.codeheadsystems.latchkey.client.model.AccountRecord;
import com.codeheadsystems.latchkey.model.lock.LockValues;
import com.codeheadsystems.latchkey.shamir.WrappedSecretBlob;
import com.codeheadsystems.latchkey.signer.EncryptedSigningKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * On-disk form of an {@link AccountRecord}. Byte fields are base64url without padding.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record AccountRecordDocument(@JsonProperty("accountId") String accountId,
                             @JsonProperty("blob") BlobDocument blob,
                             @JsonProperty("wrapKeySalt") String wrapKeySalt,
                             @JsonProperty("vrfPublicKey") String vrfPublicKey,
                             @JsonProperty("signingKeyCiphertext") String signingKeyCiphertext,
                             @JsonProperty("signingPublicKey") String signingPublicKey,
                             @JsonProperty("updatedAt") Instant updatedAt) {

  static AccountRecordDocument from(AccountRecord record) {
    return new AccountRecordDocument(
        record.accountId(),
        record.blob() == null ? null : BlobDocument.from(record.blob()),
        LockValues.encode(record.wrapKeySalt()),
        LockValues.encode(record.vrfPublicKey()),
        LockValues.encode(record.signingKey().ciphertext()),
        LockValues.encode(record.signingKey().publicKey()),
        record.updatedAt());
  }

  AccountRecord toRecord() {
    return new AccountRecord(
        accountId,
        blob == null ? null : blob.toBlob(),
        LockValues.decode(wrapKeySalt, "wrapKeySalt"),
        LockValues.decode(vrfPublicKey, "vrfPublicKey"),
        new EncryptedSigningKey(
            LockValues.decode(signingKeyCiphertext, "signingKeyCiphertext"),
            LockValues.decode(signingPublicKey, "signingPublicKey")),
        updatedAt);
  }

  record BlobDocument(@JsonProperty("ciphertext") String ciphertext,
                      @JsonProperty("serverLockedValue") String serverLockedValue,
                      @JsonProperty("serverKeyId") String serverKeyId,
                      @JsonProperty("updatedAt") Instant updatedAt) {

    static BlobDocument from(WrappedSecretBlob blob) {
      return new BlobDocument(
          LockValues.encode(blob.ciphertext()),
          LockValues.encode(blob.serverLockedValue()),
          blob.serverKeyId(),
          blob.updatedAt());
    }

    WrappedSecretBlob toBlob() {
      return new WrappedSecretBlob(
          LockValues.decode(ciphertext, "ciphertext"),
          LockValues.decode(serverLockedValue, "serverLockedValue"),
          serverKeyId,
          updatedAt);
    }
  }
}
