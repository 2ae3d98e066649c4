package com.codeheadsystems.latchkey.client.ceremony;

import java.util.concurrent.CompletableFuture;

/**
 * The user-presence ceremony (a passkey prompt, for instance). Completion may take an
 * unbounded amount of wall-clock time; callers bound it and may cancel the returned future.
 */
@FunctionalInterface
public interface AuthenticationCeremony {

  /**
   * Starts a ceremony.
   *
   * @param request the request
   * @return completes with the result, or exceptionally if the user aborts
   */
  CompletableFuture<CeremonyResult> perform(CeremonyRequest request);
}
