package com.codeheadsystems.latchkey.server.store;

import com.codeheadsystems.latchkey.model.lock.LockValues;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyRing;
import com.codeheadsystems.latchkey.shamir.GraceKey;
import com.codeheadsystems.latchkey.shamir.ServerKeypair;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import org.bouncycastle.util.BigIntegers;

/**
 * On-disk form of a {@link CooperatorKeyRing}. Big integers are stored as base64url of their
 * unsigned big-endian bytes.
 *
 * @param modulus the shared prime
 * @param current the current key
 * @param grace   retired keys, newest first
 */
record KeyRingDocument(@JsonProperty("modulus") String modulus,
                       @JsonProperty("current") KeyDocument current,
                       @JsonProperty("grace") List<GraceDocument> grace) {

  static KeyRingDocument from(CooperatorKeyRing ring) {
    return new KeyRingDocument(
        encode(ring.current().modulus()),
        KeyDocument.from(ring.current()),
        ring.grace().stream().map(GraceDocument::from).toList());
  }

  CooperatorKeyRing toKeyRing() {
    BigInteger p = decode(modulus, "modulus");
    List<GraceKey> graceKeys = grace == null ? List.of()
        : grace.stream().map(g -> new GraceKey(g.key().toKeypair(p), g.retiredAt())).toList();
    return new CooperatorKeyRing(current.toKeypair(p), graceKeys);
  }

  private static String encode(BigInteger value) {
    return LockValues.encode(BigIntegers.asUnsignedByteArray(value));
  }

  private static BigInteger decode(String value, String name) {
    return new BigInteger(1, LockValues.decode(value, name));
  }

  /**
   * One stored keypair.
   */
  record KeyDocument(@JsonProperty("keyId") String keyId,
                     @JsonProperty("e_s_b64u") String encryptExponent,
                     @JsonProperty("d_s_b64u") String decryptExponent,
                     @JsonProperty("createdAt") Instant createdAt) {

    static KeyDocument from(ServerKeypair keypair) {
      return new KeyDocument(keypair.keyId(), encode(keypair.encryptExponent()),
          encode(keypair.decryptExponent()), keypair.createdAt());
    }

    ServerKeypair toKeypair(BigInteger modulus) {
      return new ServerKeypair(decode(encryptExponent, "e_s_b64u"), decode(decryptExponent, "d_s_b64u"),
          modulus, keyId, createdAt);
    }
  }

  /**
   * One retired keypair.
   */
  record GraceDocument(@JsonProperty("key") KeyDocument key,
                       @JsonProperty("retiredAt") Instant retiredAt) {

    static GraceDocument from(GraceKey graceKey) {
      return new GraceDocument(KeyDocument.from(graceKey.keypair()), graceKey.retiredAt());
    }
  }
}
