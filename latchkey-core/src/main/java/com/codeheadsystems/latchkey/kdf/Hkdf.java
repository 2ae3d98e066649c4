package com.codeheadsystems.latchkey.kdf;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * HKDF-SHA256 (RFC 5869) extract-then-expand.
 */
public final class Hkdf {

  private Hkdf() {
  }

  /**
   * Derive key material using HKDF-SHA256.
   *
   * @param inputKeyMaterial the input key material
   * @param salt             optional salt, null means a zero-filled salt
   * @param info             context information, may be empty
   * @param outputLength     desired output length in bytes
   * @return derived key material
   */
  public static byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength) {
    if (inputKeyMaterial == null) {
      throw new IllegalArgumentException("Input key material is required");
    }
    HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
    hkdf.init(new HKDFParameters(inputKeyMaterial, salt, info));
    byte[] output = new byte[outputLength];
    hkdf.generateBytes(output, 0, outputLength);
    return output;
  }
}
