package com.codeheadsystems.latchkey.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class AeadBoxTest {

  private final AeadBox aeadBox = new AeadBox(new RandomProvider());
  private final byte[] key = new RandomProvider().randomBytes(AeadBox.KEY_LENGTH);
  private final byte[] aad = "account-1".getBytes(StandardCharsets.UTF_8);

  @Test
  void sealThenOpen() {
    byte[] plaintext = "signing key".getBytes(StandardCharsets.UTF_8);
    byte[] box = aeadBox.seal(key, plaintext, aad);

    assertThat(box).hasSize(AeadBox.NONCE_LENGTH + plaintext.length + 16);
    assertThat(aeadBox.open(key, box, aad)).isEqualTo(plaintext);
  }

  @Test
  void seal_usesFreshNonce() {
    byte[] plaintext = {1, 2, 3};
    assertThat(aeadBox.seal(key, plaintext, aad)).isNotEqualTo(aeadBox.seal(key, plaintext, aad));
  }

  @Test
  void open_wrongKeyFails() {
    byte[] box = aeadBox.seal(key, new byte[]{1}, aad);
    byte[] otherKey = key.clone();
    otherKey[0] ^= 1;

    assertThatThrownBy(() -> aeadBox.open(otherKey, box, aad))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Authentication failed");
  }

  @Test
  void open_wrongAssociatedDataFails() {
    byte[] box = aeadBox.seal(key, new byte[]{1}, aad);

    assertThatThrownBy(() -> aeadBox.open(key, box, new byte[0]))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void open_tamperedCiphertextFails() {
    byte[] box = aeadBox.seal(key, new byte[]{1, 2, 3, 4}, aad);
    box[AeadBox.NONCE_LENGTH] ^= 0x40;

    assertThatThrownBy(() -> aeadBox.open(key, box, aad))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void open_truncatedBoxFails() {
    assertThatThrownBy(() -> aeadBox.open(key, new byte[AeadBox.NONCE_LENGTH], aad))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void seal_rejectsShortKey() {
    assertThatThrownBy(() -> aeadBox.seal(new byte[16], new byte[1], aad))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
