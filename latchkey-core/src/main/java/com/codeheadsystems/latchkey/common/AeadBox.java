package com.codeheadsystems.latchkey.common;

import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * ChaCha20-Poly1305 sealed boxes with the 12-byte nonce prefixed to the ciphertext.
 * <p>
 * Box layout: {@code nonce(12) || ciphertext || tag(16)}.
 */
public class AeadBox {

  /**
   * Nonce length in bytes.
   */
  public static final int NONCE_LENGTH = 12;
  /**
   * Key length in bytes.
   */
  public static final int KEY_LENGTH = 32;
  private static final int TAG_BITS = 128;

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Aead box.
   *
   * @param randomProvider the random provider used for nonces
   */
  public AeadBox(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Encrypts and authenticates the plaintext.
   *
   * @param key            32-byte key
   * @param plaintext      the plaintext
   * @param associatedData bound but not encrypted, may be empty
   * @return nonce-prefixed box
   */
  public byte[] seal(byte[] key, byte[] plaintext, byte[] associatedData) {
    checkKey(key);
    byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
    ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
    cipher.init(true, new AEADParameters(new KeyParameter(key), TAG_BITS, nonce, associatedData));
    byte[] out = new byte[NONCE_LENGTH + cipher.getOutputSize(plaintext.length)];
    System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
    int len = cipher.processBytes(plaintext, 0, plaintext.length, out, NONCE_LENGTH);
    try {
      cipher.doFinal(out, NONCE_LENGTH + len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
    return out;
  }

  /**
   * Verifies and decrypts a box produced by {@link #seal}.
   *
   * @param key            32-byte key
   * @param box            nonce-prefixed box
   * @param associatedData must equal the value given to seal
   * @return the plaintext
   * @throws SecurityException if the tag does not verify
   */
  public byte[] open(byte[] key, byte[] box, byte[] associatedData) {
    checkKey(key);
    if (box == null || box.length < NONCE_LENGTH + TAG_BITS / 8) {
      throw new SecurityException("Authentication failed");
    }
    ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
    cipher.init(false, new AEADParameters(new KeyParameter(key), TAG_BITS,
        Arrays.copyOfRange(box, 0, NONCE_LENGTH), associatedData));
    int bodyLength = box.length - NONCE_LENGTH;
    byte[] out = new byte[cipher.getOutputSize(bodyLength)];
    int len = cipher.processBytes(box, NONCE_LENGTH, bodyLength, out, 0);
    try {
      cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      ByteUtils.zeroize(out);
      throw new SecurityException("Authentication failed");
    }
    return out;
  }

  private static void checkKey(byte[] key) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("AEAD key must be " + KEY_LENGTH + " bytes");
    }
  }
}
