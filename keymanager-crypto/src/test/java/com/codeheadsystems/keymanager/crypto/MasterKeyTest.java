package com.codeheadsystems.keymanager.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MasterKeyTest {

  @Test
  void fromHex_acceptsThirtyTwoBytes() {
    MasterKey key = MasterKey.fromHex("ff".repeat(32));

    assertThat(key.keyBytes()).hasSize(MasterKey.LENGTH);
    assertThat(key.isEphemeral()).isFalse();
  }

  @Test
  void fromHex_rejectsWrongLength() {
    assertThatThrownBy(() -> MasterKey.fromHex("ff".repeat(16)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32 bytes");
  }

  @Test
  void fromHex_rejectsInvalidHex() {
    assertThatThrownBy(() -> MasterKey.fromHex("zz".repeat(32)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("hex");
  }

  @Test
  void fromHex_rejectsBlank() {
    assertThatThrownBy(() -> MasterKey.fromHex(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void of_copiesInput() {
    byte[] raw = new byte[32];
    MasterKey key = MasterKey.of(raw);
    raw[0] = 1;

    assertThat(key.keyBytes()[0]).isZero();
  }

  @Test
  void ephemeral_isFlagged() {
    assertThat(MasterKey.ephemeral(new RandomProvider()).isEphemeral()).isTrue();
  }

  @Test
  void toString_neverRevealsKey() {
    MasterKey key = MasterKey.fromHex("ab".repeat(32));

    assertThat(key.toString()).doesNotContain("ab").contains("redacted");
  }
}
