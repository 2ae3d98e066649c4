package com.codeheadsystems.latchkey.client.model;

/**
 * Receives progress events. Called on the orchestrating thread; keep it quick.
 */
@FunctionalInterface
public interface ProgressListener {

  /**
   * Listener that ignores everything.
   */
  ProgressListener NO_OP = event -> { };

  /**
   * On progress.
   *
   * @param event the event
   */
  void onProgress(ProgressEvent event);
}
