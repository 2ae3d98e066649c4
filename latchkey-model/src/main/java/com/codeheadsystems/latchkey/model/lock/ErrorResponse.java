package com.codeheadsystems.latchkey.model.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the cooperator API.
 *
 * @param error   machine-readable code, e.g. {@code unknown_key_id}
 * @param message human-readable detail
 */
public record ErrorResponse(@JsonProperty("error") String error,
                            @JsonProperty("message") String message) {

  /**
   * Error code for a lock removal under a key the cooperator does not hold.
   */
  public static final String UNKNOWN_KEY_ID = "unknown_key_id";
}
