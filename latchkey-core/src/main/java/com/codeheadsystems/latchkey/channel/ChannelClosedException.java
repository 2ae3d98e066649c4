package com.codeheadsystems.latchkey.channel;

/**
 * The sending side of a one-time channel was closed without delivering a value.
 */
public class ChannelClosedException extends RuntimeException {

  /**
   * Instantiates a new Channel closed exception.
   *
   * @param message the message
   */
  public ChannelClosedException(final String message) {
    super(message);
  }
}
