package com.codeheadsystems.latchkey.signer;

import java.util.Arrays;

/**
 * An Ed25519 private key sealed under a near-KEK. The public key travels in the clear and is
 * bound to the ciphertext as associated data.
 *
 * @param ciphertext nonce-prefixed AEAD box of the 32-byte private key
 * @param publicKey  the 32-byte Ed25519 public key
 */
public record EncryptedSigningKey(byte[] ciphertext, byte[] publicKey) {

  /**
   * Instantiates a new Encrypted signing key.
   *
   * @param ciphertext the ciphertext
   * @param publicKey  the public key
   */
  public EncryptedSigningKey {
    if (ciphertext == null || ciphertext.length == 0) {
      throw new IllegalArgumentException("Missing required field: ciphertext");
    }
    if (publicKey == null || publicKey.length != SigningKeyVault.PUBLIC_KEY_LENGTH) {
      throw new IllegalArgumentException("publicKey must be " + SigningKeyVault.PUBLIC_KEY_LENGTH + " bytes");
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptedSigningKey other
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(publicKey, other.publicKey);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(publicKey);
  }
}
