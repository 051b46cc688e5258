package com.codeheadsystems.keymanager.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_joinsInOrder() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[]{}, new byte[]{3}))
        .isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void concat_noArgumentsIsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  // ─── toFixedLength ────────────────────────────────────────────────────────

  @Test
  void toFixedLength_padsShortValues() {
    assertThat(ByteUtils.toFixedLength(BigInteger.valueOf(0x0102), 4))
        .isEqualTo(new byte[]{0, 0, 1, 2});
  }

  @Test
  void toFixedLength_stripsSignByte() {
    // 0xFF.. has its high bit set, so toByteArray() yields 33 bytes for a 32-byte value.
    BigInteger value = new BigInteger(1, filled(32, (byte) 0xFF));
    assertThat(value.toByteArray()).hasSize(33);

    assertThat(ByteUtils.toFixedLength(value, 32)).isEqualTo(filled(32, (byte) 0xFF));
  }

  @Test
  void toFixedLength_tooLargeThrows() {
    assertThatThrownBy(() -> ByteUtils.toFixedLength(BigInteger.valueOf(0x010000), 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("too large");
  }

  @Test
  void toFixedLength_negativeThrows() {
    assertThatThrownBy(() -> ByteUtils.toFixedLength(BigInteger.valueOf(-1), 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── zeroize ──────────────────────────────────────────────────────────────

  @Test
  void zeroize_clearsInPlace() {
    byte[] secret = {9, 8, 7};
    ByteUtils.zeroize(secret);
    assertThat(secret).containsOnly(0);
  }

  @Test
  void zeroize_ignoresNull() {
    ByteUtils.zeroize(null);
  }

  private static byte[] filled(int length, byte value) {
    byte[] out = new byte[length];
    java.util.Arrays.fill(out, value);
    return out;
  }
}
