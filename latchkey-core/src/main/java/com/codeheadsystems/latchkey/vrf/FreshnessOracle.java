package com.codeheadsystems.latchkey.vrf;

/**
 * Ledger client used only as a source of fresh block references.
 */
public interface FreshnessOracle {

  /**
   * The most recent finalized block.
   *
   * @return the block reference
   */
  BlockReference latestBlock();
}
