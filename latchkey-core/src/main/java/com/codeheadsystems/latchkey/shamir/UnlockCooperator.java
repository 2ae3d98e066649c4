package com.codeheadsystems.latchkey.shamir;

import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the Shamir three-pass exchange.
 * <p>
 * Registration: {@code KEK -> KEK^c -> KEK^cs -> KEK^s}, persisting the secret sealed under the
 * KEK together with {@code KEK^s} and the cooperator key id. Unlock:
 * {@code KEK^s -> KEK^st -> KEK^t -> KEK} with a fresh client lock each time. The cooperator
 * never sees the KEK or the secret.
 */
public class UnlockCooperator {

  private static final Logger log = LoggerFactory.getLogger(UnlockCooperator.class);

  private final CommutativeCipher cipher;
  private final LockCooperator cooperator;
  private final Clock clock;

  /**
   * Instantiates a new Unlock cooperator.
   *
   * @param cipher     the cipher
   * @param cooperator the cooperator
   * @param clock      the clock
   */
  public UnlockCooperator(final CommutativeCipher cipher, final LockCooperator cooperator, final Clock clock) {
    this.cipher = cipher;
    this.cooperator = cooperator;
    this.clock = clock;
    log.info("UnlockCooperator({}, modulusBits={})", cooperator, cipher.modulus().bitLength());
  }

  /**
   * Wraps the secret under a fresh random KEK.
   *
   * @param secret the long-term secret
   * @return the blob to persist
   */
  public WrappedSecretBlob register(byte[] secret) {
    return register(secret, cipher.randomKek());
  }

  /**
   * Wraps the secret under the given KEK.
   *
   * @param secret the long-term secret
   * @param kek    the kek, in {@code [2, p-2]}
   * @return the blob to persist
   */
  public WrappedSecretBlob register(byte[] secret, BigInteger kek) {
    cipher.checkValue(kek);
    byte[] ciphertext = cipher.seal(kek, secret);
    LockKeys clientKeys = cipher.generateLockKeys();
    BigInteger kekC = cipher.addLock(kek, clientKeys.encryptExponent());
    LockedValue kekCs = cooperator.applyLock(kekC);
    BigInteger kekS = cipher.removeLock(kekCs.value(), clientKeys.decryptExponent());
    log.debug("register() locked under keyId={}", kekCs.keyId());
    return new WrappedSecretBlob(ciphertext, cipher.encode(kekS), kekCs.keyId(), clock.instant());
  }

  /**
   * Recovers the secret with the cooperator's help.
   *
   * @param blob the stored blob
   * @return the long-term secret
   * @throws UnknownKeyIdException if the cooperator no longer knows the blob's key
   * @throws SecurityException     if the recovered KEK does not open the ciphertext
   */
  public byte[] unlock(WrappedSecretBlob blob) {
    BigInteger kekS = cipher.decode(blob.serverLockedValue());
    LockKeys clientKeys = cipher.generateLockKeys();
    BigInteger kekSt = cipher.addLock(kekS, clientKeys.encryptExponent());
    BigInteger kekT = cooperator.removeLock(kekSt, blob.serverKeyId());
    BigInteger kek = cipher.removeLock(kekT, clientKeys.decryptExponent());
    log.debug("unlock() keyId={}", blob.serverKeyId());
    return cipher.open(kek, blob.ciphertext());
  }

  /**
   * Re-wraps under the cooperator's current key when the blob was locked by an older one.
   *
   * @param blob   the blob that was just unlocked
   * @param secret the secret it contained
   * @return the replacement blob, or empty if the blob is already current
   */
  public Optional<WrappedSecretBlob> migrateIfRotated(WrappedSecretBlob blob, byte[] secret) {
    CooperatorKeyInfo info = cooperator.keyInfo();
    if (!cipher.modulus().equals(info.modulus())) {
      throw new IllegalStateException("Cooperator advertises a different modulus");
    }
    if (info.currentKeyId().equals(blob.serverKeyId())) {
      return Optional.empty();
    }
    log.info("migrateIfRotated() {} -> {}", blob.serverKeyId(), info.currentKeyId());
    return Optional.of(register(secret));
  }

  /**
   * Current key info from the cooperator.
   *
   * @return the cooperator key info
   */
  public CooperatorKeyInfo keyInfo() {
    return cooperator.keyInfo();
  }
}
