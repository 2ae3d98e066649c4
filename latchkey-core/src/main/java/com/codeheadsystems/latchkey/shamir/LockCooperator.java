package com.codeheadsystems.latchkey.shamir;

import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import java.math.BigInteger;

/**
 * The remote party in the three-pass exchange. It only ever sees blinded values.
 */
public interface LockCooperator {

  /**
   * Applies the cooperator's current lock.
   *
   * @param blindedValue a value already carrying the client's ephemeral lock
   * @return the double-locked value and the id of the key that locked it
   */
  LockedValue applyLock(BigInteger blindedValue);

  /**
   * Removes the lock of the named key. The key id must match the current key or a grace key
   * exactly; no other key is ever tried.
   *
   * @param blindedValue a value carrying the cooperator's lock and a fresh client lock
   * @param keyId        the key id recorded when the value was locked
   * @return the value with only the client lock left
   * @throws UnknownKeyIdException if the key id is neither current nor in the grace list
   */
  BigInteger removeLock(BigInteger blindedValue, String keyId);

  /**
   * Advertised key state, used by clients to detect rotation.
   *
   * @return the cooperator key info
   */
  CooperatorKeyInfo keyInfo();
}
