package com.codeheadsystems.latchkey.client.ceremony;

/**
 * Why a ceremony is being run.
 */
public enum Purpose {
  /** First-time enrolment. Must return a secondary secret. */
  REGISTER,
  /** Cold-path unlock, bound to a VRF challenge. */
  AUTHENTICATE,
  /** The extra prompt taken when the cooperator cannot help. Must return a secondary secret. */
  RECOVER
}
