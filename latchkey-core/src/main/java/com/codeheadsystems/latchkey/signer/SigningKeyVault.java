package com.codeheadsystems.latchkey.signer;

import com.codeheadsystems.latchkey.common.AeadBox;
import com.codeheadsystems.latchkey.common.ByteUtils;
import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.exceptions.DerivationMismatchException;
import java.security.MessageDigest;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates Ed25519 signing keys and seals them under a near-KEK. Opening checks both the AEAD
 * tag and that the recovered private key reproduces the stored public key.
 */
public class SigningKeyVault {

  /**
   * Ed25519 private key length.
   */
  public static final int PRIVATE_KEY_LENGTH = Ed25519PrivateKeyParameters.KEY_SIZE;
  /**
   * Ed25519 public key length.
   */
  public static final int PUBLIC_KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;

  private static final Logger log = LoggerFactory.getLogger(SigningKeyVault.class);

  private final RandomProvider randomProvider;
  private final AeadBox aeadBox;

  /**
   * Instantiates a new Signing key vault.
   *
   * @param randomProvider the random provider
   */
  public SigningKeyVault(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
    this.aeadBox = new AeadBox(randomProvider);
  }

  /**
   * Verifies an Ed25519 signature.
   *
   * @param publicKey the public key
   * @param payload   the signed bytes
   * @param signature the signature
   * @return true if valid
   */
  public static boolean verify(byte[] publicKey, byte[] payload, byte[] signature) {
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
    verifier.update(payload, 0, payload.length);
    return verifier.verifySignature(signature);
  }

  /**
   * Generates a fresh key and seals it. The plaintext private key never leaves this method.
   *
   * @param kek the near-KEK
   * @return the sealed key
   */
  public EncryptedSigningKey generate(byte[] kek) {
    byte[] privateKey = randomProvider.randomBytes(PRIVATE_KEY_LENGTH);
    try {
      EncryptedSigningKey sealed = seal(kek, privateKey);
      log.debug("generate(): new signing key");
      return sealed;
    } finally {
      ByteUtils.zeroize(privateKey);
    }
  }

  /**
   * Seals an existing private key, e.g. when re-wrapping under a new salt.
   *
   * @param kek        the near-KEK
   * @param privateKey the 32-byte private key
   * @return the sealed key
   */
  public EncryptedSigningKey seal(byte[] kek, byte[] privateKey) {
    if (privateKey == null || privateKey.length != PRIVATE_KEY_LENGTH) {
      throw new IllegalArgumentException("privateKey must be " + PRIVATE_KEY_LENGTH + " bytes");
    }
    byte[] publicKey = new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    return new EncryptedSigningKey(aeadBox.seal(kek, privateKey, publicKey), publicKey);
  }

  /**
   * Opens a sealed key.
   *
   * @param kek the near-KEK
   * @param key the sealed key
   * @return the private key; caller zeroizes
   * @throws DerivationMismatchException if the tag fails or the public key does not match
   */
  public byte[] open(byte[] kek, EncryptedSigningKey key) {
    byte[] privateKey;
    try {
      privateKey = aeadBox.open(kek, key.ciphertext(), key.publicKey());
    } catch (SecurityException e) {
      throw new DerivationMismatchException("Signing key failed to authenticate under derived key", e);
    }
    if (privateKey.length != PRIVATE_KEY_LENGTH) {
      ByteUtils.zeroize(privateKey);
      throw new DerivationMismatchException("Signing key has wrong length");
    }
    byte[] derivedPublic = new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    if (!MessageDigest.isEqual(derivedPublic, key.publicKey())) {
      ByteUtils.zeroize(privateKey);
      throw new DerivationMismatchException("Signing key does not match its public key");
    }
    return privateKey;
  }

  /**
   * Signs with a plaintext private key.
   *
   * @param privateKey the private key
   * @param payload    the payload
   * @return the signature
   */
  public byte[] sign(byte[] privateKey, byte[] payload) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, new Ed25519PrivateKeyParameters(privateKey, 0));
    signer.update(payload, 0, payload.length);
    return signer.generateSignature();
  }
}
