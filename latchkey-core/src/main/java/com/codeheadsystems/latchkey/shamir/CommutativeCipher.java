package com.codeheadsystems.latchkey.shamir;

import com.codeheadsystems.latchkey.common.AeadBox;
import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.kdf.Hkdf;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Commutative encryption by modular exponentiation over a shared prime, the arithmetic behind
 * the Shamir three-pass exchange. A lock is {@code value^e mod p} and is removed by
 * {@code value^d mod p} where {@code e*d = 1 mod (p-1)}. Locks from different parties commute.
 * <p>
 * Also seals the wrapped secret under a KEK value with ChaCha20-Poly1305, keyed by
 * {@code HKDF-SHA256(kek, info="latchkey-shamir-aead-v1")}.
 */
public class CommutativeCipher {

  /**
   * The 2048-bit MODP group prime from RFC 3526 section 3. A safe prime.
   */
  public static final BigInteger RFC3526_MODP_2048 = new BigInteger(
      "FFFFFFFFFFFFFFFFC90FDAA22168C234C4C6628B80DC1CD129024E088A67CC74020BBEA63B139B22514A0879"
          + "8E3404DDEF9519B3CD3A431B302B0A6DF25F14374FE1356D6D51C245E485B576625E7EC6F44C42E9A637ED6B"
          + "0BFF5CB6F406B7EDEE386BFB5A899FA5AE9F24117C4B1FE649286651ECE45B3DC2007CB8A163BF0598DA4836"
          + "1C55D39A69163FA8FD24CF5F83655D23DCA3AD961C62F356208552BB9ED529077096966D670C354E4ABC9804"
          + "F1746C08CA18217C32905E462E36CE3BE39E772C180E86039B2783A2EC07A28FB5C55DF06F4C52C9DE2BCBF6"
          + "955817183995497CEA956AE515D2261898FA051015728E5A8AACAA68FFFFFFFFFFFFFFFF", 16);

  /**
   * Smallest accepted prime size in bits.
   */
  public static final int MIN_PRIME_BITS = 127;

  private static final byte[] AEAD_INFO = "latchkey-shamir-aead-v1".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] NO_AAD = new byte[0];
  private static final BigInteger TWO = BigInteger.valueOf(2);

  private final BigInteger p;
  private final BigInteger pMinusOne;
  private final BigInteger minK;
  private final BigInteger maxK;
  private final int encodedLength;
  private final RandomProvider randomProvider;
  private final AeadBox aeadBox;

  /**
   * Instantiates a cipher over the RFC 3526 2048-bit prime.
   */
  public CommutativeCipher() {
    this(RFC3526_MODP_2048, new RandomProvider());
  }

  /**
   * Instantiates a new Commutative cipher.
   *
   * @param p              the shared prime, at least {@value #MIN_PRIME_BITS} bits
   * @param randomProvider the random provider
   */
  public CommutativeCipher(BigInteger p, RandomProvider randomProvider) {
    if (p == null || p.bitLength() < MIN_PRIME_BITS) {
      throw new IllegalArgumentException("Prime must be at least " + MIN_PRIME_BITS + " bits");
    }
    if (!p.isProbablePrime(64)) {
      throw new IllegalArgumentException("Modulus is not prime");
    }
    this.p = p;
    this.pMinusOne = p.subtract(BigInteger.ONE);
    this.minK = p.bitLength() >= 1024 ? BigInteger.ONE.shiftLeft(64) : BigInteger.ONE.shiftLeft(32);
    this.maxK = p.subtract(TWO);
    this.encodedLength = (p.bitLength() + 7) / 8;
    this.randomProvider = randomProvider;
    this.aeadBox = new AeadBox(randomProvider);
  }

  /**
   * The shared prime.
   *
   * @return the modulus
   */
  public BigInteger modulus() {
    return p;
  }

  /**
   * Fixed width in bytes of an encoded group value.
   *
   * @return the encoded length
   */
  public int encodedLength() {
    return encodedLength;
  }

  /**
   * Random value in {@code [minK, p-2]} coprime to {@code p-1}. Used for lock exponents and KEKs.
   *
   * @return the random exponent
   */
  public BigInteger randomExponent() {
    BigInteger range = maxK.subtract(minK).add(BigInteger.ONE);
    while (true) {
      BigInteger k = minK.add(randomProvider.randomBelow(range));
      if (k.gcd(pMinusOne).equals(BigInteger.ONE)) {
        return k;
      }
    }
  }

  /**
   * Fresh random key-encryption-key.
   *
   * @return the kek
   */
  public BigInteger randomKek() {
    return randomExponent();
  }

  /**
   * Generates an encrypt/decrypt exponent pair.
   *
   * @return the lock keys
   */
  public LockKeys generateLockKeys() {
    BigInteger e = randomExponent();
    return new LockKeys(e, e.modInverse(pMinusOne));
  }

  /**
   * Applies a lock.
   *
   * @param value            the value, in {@code [2, p-2]}
   * @param encryptExponent the encrypt exponent
   * @return {@code value^e mod p}
   */
  public BigInteger addLock(BigInteger value, BigInteger encryptExponent) {
    checkValue(value);
    return value.modPow(encryptExponent, p);
  }

  /**
   * Removes a lock. Same arithmetic as {@link #addLock} with the inverse exponent.
   *
   * @param value            the value, in {@code [2, p-2]}
   * @param decryptExponent the decrypt exponent
   * @return {@code value^d mod p}
   */
  public BigInteger removeLock(BigInteger value, BigInteger decryptExponent) {
    checkValue(value);
    return value.modPow(decryptExponent, p);
  }

  /**
   * Rejects values that are out of range or that would leak through exponentiation
   * (0, 1 and p-1 are fixed points).
   *
   * @param value the value
   */
  public void checkValue(BigInteger value) {
    if (value == null || value.compareTo(TWO) < 0 || value.compareTo(maxK) > 0) {
      throw new IllegalArgumentException("Value out of range for modulus");
    }
  }

  /**
   * Fixed-width big-endian encoding.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public byte[] encode(BigInteger value) {
    return ByteUtils.toFixedLength(value, encodedLength);
  }

  /**
   * Decodes and range-checks a value produced by {@link #encode}.
   *
   * @param encoded the encoded
   * @return the big integer
   */
  public BigInteger decode(byte[] encoded) {
    if (encoded == null || encoded.length != encodedLength) {
      throw new IllegalArgumentException("Encoded value must be " + encodedLength + " bytes");
    }
    BigInteger value = new BigInteger(1, encoded);
    checkValue(value);
    return value;
  }

  /**
   * Key identifier: {@code base64url(SHA-256(encode(e)))} without padding.
   *
   * @param encryptExponent the encrypt exponent
   * @return the key id
   */
  public String keyId(BigInteger encryptExponent) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(encode(encryptExponent));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Seals plaintext under the KEK.
   *
   * @param kek       the kek
   * @param plaintext the plaintext
   * @return nonce-prefixed ciphertext
   */
  public byte[] seal(BigInteger kek, byte[] plaintext) {
    byte[] key = aeadKey(kek);
    try {
      return aeadBox.seal(key, plaintext, NO_AAD);
    } finally {
      ByteUtils.zeroize(key);
    }
  }

  /**
   * Opens a box produced by {@link #seal}.
   *
   * @param kek the kek
   * @param box the box
   * @return the plaintext
   * @throws SecurityException if the KEK is wrong or the box was modified
   */
  public byte[] open(BigInteger kek, byte[] box) {
    byte[] key = aeadKey(kek);
    try {
      return aeadBox.open(key, box, NO_AAD);
    } finally {
      ByteUtils.zeroize(key);
    }
  }

  private byte[] aeadKey(BigInteger kek) {
    byte[] kekBytes = encode(kek);
    try {
      return Hkdf.derive(kekBytes, null, AEAD_INFO, AeadBox.KEY_LENGTH);
    } finally {
      ByteUtils.zeroize(kekBytes);
    }
  }
}
