package com.codeheadsystems.latchkey.vrf;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * A ledger block used as freshness material for challenges.
 *
 * @param height the block height
 * @param hash   the block hash
 */
public record BlockReference(long height, byte[] hash) {

  @Override
  public boolean equals(Object o) {
    return o instanceof BlockReference that && height == that.height && Arrays.equals(hash, that.hash);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(height) + Arrays.hashCode(hash);
  }

  @Override
  public String toString() {
    return "BlockReference[height=" + height + ", hash=" + Hex.toHexString(hash) + "]";
  }
}
