package com.codeheadsystems.latchkey.dropwizard.tasks;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.latchkey.common.RandomProvider;
import com.codeheadsystems.latchkey.shamir.CommutativeCipher;
import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import com.codeheadsystems.latchkey.shamir.GracePolicy;
import com.codeheadsystems.latchkey.shamir.InMemoryKeyRingStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CooperatorKeyTasksTest {

  private static final BigInteger M127 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

  private CooperatorKeyManager keyManager;
  private StringWriter buffer;
  private PrintWriter output;

  @BeforeEach
  void setUp() {
    keyManager = new CooperatorKeyManager(new CommutativeCipher(M127, new RandomProvider()),
        new InMemoryKeyRingStore(), GracePolicy.DEFAULT, Clock.systemUTC());
    buffer = new StringWriter();
    output = new PrintWriter(buffer);
  }

  @Test
  void rotate_defaultsToKeepingPreviousKeyInGrace() {
    String before = keyManager.currentKeyId();

    new RotateCooperatorKeyTask(keyManager).execute(Map.of(), output);

    assertThat(keyManager.currentKeyId()).isNotEqualTo(before);
    assertThat(keyManager.keyInfo().graceKeyIds()).containsExactly(before);
    assertThat(buffer.toString()).contains("previousKeyId=" + before, "currentKeyId=" + keyManager.currentKeyId());
  }

  @Test
  void rotate_withoutGrace_dropsPreviousKey() {
    new RotateCooperatorKeyTask(keyManager).execute(Map.of("keepInGrace", List.of("false")), output);

    assertThat(keyManager.keyInfo().graceKeyIds()).isEmpty();
  }

  @Test
  void removeGraceKey_reportsOutcome() {
    String retired = keyManager.currentKeyId();
    keyManager.rotate(true);
    RemoveGraceKeyTask task = new RemoveGraceKeyTask(keyManager);

    task.execute(Map.of("keyId", List.of(retired)), output);
    task.execute(Map.of("keyId", List.of(retired)), output);

    assertThat(buffer.toString()).contains(retired + ": removed", retired + ": not in grace list");
    assertThat(keyManager.keyInfo().graceKeyIds()).isEmpty();
  }

  @Test
  void removeGraceKey_withoutKeyId_changesNothing() {
    keyManager.rotate(true);

    new RemoveGraceKeyTask(keyManager).execute(Map.of(), output);

    assertThat(buffer.toString()).contains("Missing required parameter: keyId");
    assertThat(keyManager.keyInfo().graceKeyIds()).hasSize(1);
  }
}
