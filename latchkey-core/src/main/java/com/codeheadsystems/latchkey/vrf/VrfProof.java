package com.codeheadsystems.latchkey.vrf;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * A VRF output together with the proof that {@code publicKey} produced it.
 *
 * @param output    32-byte VRF output, used as the externally visible challenge
 * @param proof     81-byte proof: gamma(33) || c(16) || s(32)
 * @param publicKey compressed P-256 public key
 */
public record VrfProof(byte[] output, byte[] proof, byte[] publicKey) {

  @Override
  public boolean equals(Object o) {
    return o instanceof VrfProof that
        && Arrays.equals(output, that.output)
        && Arrays.equals(proof, that.proof)
        && Arrays.equals(publicKey, that.publicKey);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(output) + Arrays.hashCode(proof)) + Arrays.hashCode(publicKey);
  }

  @Override
  public String toString() {
    return "VrfProof[output=" + Hex.toHexString(output) + ", publicKey=" + Hex.toHexString(publicKey) + "]";
  }
}
