package com.codeheadsystems.latchkey.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── I2OSP ────────────────────────────────────────────────────────────────

  @Test
  void i2osp_fourByteLengthPrefix() {
    assertThat(ByteUtils.I2OSP(258, 4)).isEqualTo(new byte[]{0x00, 0x00, 0x01, 0x02});
  }

  @Test
  void i2osp_valueTooLargeThrows() {
    assertThatThrownBy(() -> ByteUtils.I2OSP(256, 1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Value too large for specified length");
  }

  // ─── littleEndian64 ───────────────────────────────────────────────────────

  @Test
  void littleEndian64_lowByteFirst() {
    assertThat(ByteUtils.littleEndian64(0x0102L))
        .isEqualTo(new byte[]{0x02, 0x01, 0, 0, 0, 0, 0, 0});
  }

  @Test
  void littleEndian64_negativeThrows() {
    assertThatThrownBy(() -> ByteUtils.littleEndian64(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── toFixedLength ────────────────────────────────────────────────────────

  @Test
  void toFixedLength_padsOnTheLeft() {
    assertThat(ByteUtils.toFixedLength(BigInteger.valueOf(0xABCD), 4))
        .isEqualTo(new byte[]{0, 0, (byte) 0xAB, (byte) 0xCD});
  }

  @Test
  void toFixedLength_stripsSignByte() {
    // 0xFF needs a leading zero in two's complement
    assertThat(ByteUtils.toFixedLength(BigInteger.valueOf(0xFF), 1)).isEqualTo(new byte[]{(byte) 0xFF});
  }

  @Test
  void toFixedLength_tooLargeThrows() {
    assertThatThrownBy(() -> ByteUtils.toFixedLength(BigInteger.valueOf(0x1_0000), 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── concat / zeroize / copy ──────────────────────────────────────────────

  @Test
  void concat_joinsInOrder() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3}))
        .isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void zeroize_wipesAllAndSkipsNulls() {
    byte[] a = {1, 2};
    byte[] b = {3};
    ByteUtils.zeroize(a, null, b);
    assertThat(a).containsOnly(0);
    assertThat(b).containsOnly(0);
  }

  @Test
  void copy_isIndependent() {
    byte[] source = {9, 9};
    byte[] copy = ByteUtils.copy(source);
    source[0] = 0;
    assertThat(copy).isEqualTo(new byte[]{9, 9});
    assertThat(ByteUtils.copy(null)).isNull();
  }
}
