package com.codeheadsystems.latchkey.kdf;

import com.codeheadsystems.latchkey.common.ByteUtils;
import java.nio.charset.StandardCharsets;

/**
 * Two-factor derivation chain that turns a fresh authentication secret plus the unlocked
 * long-term secret into a short-lived wrapping seed, and that seed plus the per-account salt
 * into the key that opens the signing key.
 * <pre>
 *   passFactor  = HKDF(authSecret,                    info="wrap-pass")
 *   wrapKeySeed = HKDF(passFactor || longTermSecret,  info="wrap-seed")
 *   kek         = HKDF(wrapKeySeed, salt=wrapKeySalt, info="near-kek")
 * </pre>
 * All methods are pure: no I/O, no state, identical output for identical input. Callers own
 * the returned arrays and are expected to zeroize them.
 */
public class KeyDerivationPipeline {

  /**
   * Output length of every stage.
   */
  public static final int KEY_LENGTH = 32;
  /**
   * Length of the recovery seed fed into VRF key derivation.
   */
  public static final int RECOVERY_SEED_LENGTH = 48;

  static final byte[] INFO_PASS = "wrap-pass".getBytes(StandardCharsets.US_ASCII);
  static final byte[] INFO_SEED = "wrap-seed".getBytes(StandardCharsets.US_ASCII);
  static final byte[] INFO_KEK = "near-kek".getBytes(StandardCharsets.US_ASCII);
  static final byte[] INFO_RECOVERY = "vrf-keypair-recovery".getBytes(StandardCharsets.US_ASCII);

  /**
   * First stage. Binds the ceremony secret under its own label.
   *
   * @param authSecret primary secret from a fresh authentication ceremony
   * @return the pass factor
   */
  public byte[] passFactor(byte[] authSecret) {
    requirePresent(authSecret, "authSecret");
    return Hkdf.derive(authSecret, null, INFO_PASS, KEY_LENGTH);
  }

  /**
   * Second stage. The intermediate pass factor is wiped before returning.
   *
   * @param authSecret     primary secret from a fresh authentication ceremony
   * @param longTermSecret the unlocked long-term secret
   * @return the wrap key seed
   */
  public byte[] wrapKeySeed(byte[] authSecret, byte[] longTermSecret) {
    requirePresent(longTermSecret, "longTermSecret");
    byte[] passFactor = passFactor(authSecret);
    byte[] ikm = ByteUtils.concat(passFactor, longTermSecret);
    try {
      return Hkdf.derive(ikm, null, INFO_SEED, KEY_LENGTH);
    } finally {
      ByteUtils.zeroize(passFactor, ikm);
    }
  }

  /**
   * Final stage, run inside the signing unit only.
   *
   * @param wrapKeySeed the wrap key seed
   * @param wrapKeySalt the per-account salt stored with the wrapped blob
   * @return the decryption key for the signing key
   */
  public byte[] decryptionKey(byte[] wrapKeySeed, byte[] wrapKeySalt) {
    requirePresent(wrapKeySeed, "wrapKeySeed");
    requirePresent(wrapKeySalt, "wrapKeySalt");
    return Hkdf.derive(wrapKeySeed, wrapKeySalt, INFO_KEK, KEY_LENGTH);
  }

  /**
   * Seed for deterministic VRF key recovery from the ceremony's secondary secret.
   *
   * @param secondarySecret the secondary secret, used only on the recovery path
   * @param accountId       the account the key belongs to
   * @return 48 bytes of seed material
   */
  public byte[] recoverySeed(byte[] secondarySecret, String accountId) {
    requirePresent(secondarySecret, "secondarySecret");
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: accountId");
    }
    return Hkdf.derive(secondarySecret, accountId.getBytes(StandardCharsets.UTF_8),
        INFO_RECOVERY, RECOVERY_SEED_LENGTH);
  }

  private static void requirePresent(byte[] value, String name) {
    if (value == null || value.length == 0) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }
}
