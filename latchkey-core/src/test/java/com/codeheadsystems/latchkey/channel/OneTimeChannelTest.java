package com.codeheadsystems.latchkey.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class OneTimeChannelTest {

  @Test
  void sendThenReceive() throws Exception {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    channel.sender().send("grant");

    assertThat(channel.receiver().receive(Duration.ofSeconds(1))).isEqualTo("grant");
    assertThat(channel.sender().isUsed()).isTrue();
  }

  @Test
  void receive_blocksUntilSend() throws Exception {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
      try {
        return channel.receiver().receive(Duration.ofSeconds(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
    });
    Thread.sleep(50);
    assertThat(received).isNotDone();

    channel.sender().send("late");

    assertThat(received.get(5, TimeUnit.SECONDS)).isEqualTo("late");
  }

  @Test
  void secondSend_fails() {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    channel.sender().send("one");

    assertThatThrownBy(() -> channel.sender().send("two"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Channel already used");
  }

  @Test
  void secondReceive_fails() throws Exception {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    channel.sender().send("one");
    channel.receiver().receive(Duration.ofSeconds(1));

    assertThatThrownBy(() -> channel.receiver().receive(Duration.ofSeconds(1)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void close_wakesReceiver() {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    channel.sender().close();

    assertThatThrownBy(() -> channel.receiver().receive(Duration.ofSeconds(1)))
        .isInstanceOf(ChannelClosedException.class)
        .hasMessage("Channel closed before delivery");
    assertThatThrownBy(() -> channel.sender().send("too late"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void close_afterSend_keepsValue() throws Exception {
    OneTimeChannel<String> channel = OneTimeChannel.create();
    channel.sender().send("kept");
    channel.sender().close();

    assertThat(channel.receiver().receive(Duration.ofSeconds(1))).isEqualTo("kept");
  }

  @Test
  void receive_timesOut() {
    OneTimeChannel<String> channel = OneTimeChannel.create();

    assertThatThrownBy(() -> channel.receiver().receive(Duration.ofMillis(20)))
        .isInstanceOf(ChannelClosedException.class)
        .hasMessageContaining("Timed out");
  }
}
