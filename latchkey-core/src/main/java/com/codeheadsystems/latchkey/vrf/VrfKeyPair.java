package com.codeheadsystems.latchkey.vrf;

import com.codeheadsystems.latchkey.common.ByteUtils;
import javax.security.auth.Destroyable;
import org.bouncycastle.util.encoders.Hex;

/**
 * A VRF key pair. The secret key is the account's long-term secret.
 *
 * @param secretKey 32-byte big-endian scalar
 * @param publicKey compressed P-256 point
 */
public record VrfKeyPair(byte[] secretKey, byte[] publicKey) implements Destroyable {

  @Override
  public void destroy() {
    ByteUtils.zeroize(secretKey);
  }

  @Override
  public String toString() {
    return "VrfKeyPair[publicKey=" + Hex.toHexString(publicKey) + "]";
  }
}
