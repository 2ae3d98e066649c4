package com.codeheadsystems.latchkey.channel;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A pair of linked endpoints that carries exactly one value from one owner to another. Each
 * endpoint can be used once; a channel is created per hand-off and never reused.
 *
 * @param <T> the value type
 */
public final class OneTimeChannel<T> {

  private final CompletableFuture<T> slot = new CompletableFuture<>();
  private final Sender<T> sender = new Sender<>(slot);
  private final Receiver<T> receiver = new Receiver<>(slot);

  private OneTimeChannel() {
  }

  /**
   * Creates a fresh channel.
   *
   * @param <T> the value type
   * @return the channel
   */
  public static <T> OneTimeChannel<T> create() {
    return new OneTimeChannel<>();
  }

  /**
   * The sending endpoint.
   *
   * @return the sender
   */
  public Sender<T> sender() {
    return sender;
  }

  /**
   * The receiving endpoint.
   *
   * @return the receiver
   */
  public Receiver<T> receiver() {
    return receiver;
  }

  /**
   * Sending endpoint.
   *
   * @param <T> the value type
   */
  public static final class Sender<T> {
    private final CompletableFuture<T> slot;
    private final AtomicBoolean used = new AtomicBoolean();

    private Sender(CompletableFuture<T> slot) {
      this.slot = slot;
    }

    /**
     * Delivers the value.
     *
     * @param value the value
     * @throws IllegalStateException if this sender was already used or closed
     */
    public void send(T value) {
      if (value == null) {
        throw new IllegalArgumentException("Cannot send null");
      }
      if (!used.compareAndSet(false, true)) {
        throw new IllegalStateException("Channel already used");
      }
      slot.complete(value);
    }

    /**
     * Abandons the channel. A waiting receiver fails with {@link ChannelClosedException}.
     * No effect after a successful send.
     */
    public void close() {
      if (used.compareAndSet(false, true)) {
        slot.completeExceptionally(new ChannelClosedException("Channel closed before delivery"));
      }
    }

    /**
     * Whether send or close has been called.
     *
     * @return true if used
     */
    public boolean isUsed() {
      return used.get();
    }
  }

  /**
   * Receiving endpoint.
   *
   * @param <T> the value type
   */
  public static final class Receiver<T> {
    private final CompletableFuture<T> slot;
    private final AtomicBoolean used = new AtomicBoolean();

    private Receiver(CompletableFuture<T> slot) {
      this.slot = slot;
    }

    /**
     * Blocks until the value arrives, the sender closes, or the timeout passes.
     *
     * @param timeout the timeout
     * @return the value
     * @throws ChannelClosedException if the sender closed, or the wait timed out
     * @throws InterruptedException   if the waiting thread is interrupted
     * @throws IllegalStateException  if this receiver was already used
     */
    public T receive(Duration timeout) throws InterruptedException {
      if (!used.compareAndSet(false, true)) {
        throw new IllegalStateException("Channel already used");
      }
      try {
        return slot.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof ChannelClosedException closed) {
          throw closed;
        }
        throw new IllegalStateException("Channel failed", e.getCause());
      } catch (TimeoutException e) {
        throw new ChannelClosedException("Timed out after " + timeout + " waiting for delivery");
      } catch (CancellationException e) {
        throw new ChannelClosedException("Channel cancelled");
      }
    }
  }
}
