package com.codeheadsystems.sealedbid.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class AmountsTest {

  @Test
  void requireUnsigned_acceptsBounds() {
    assertThat(Amounts.requireUnsigned(BigInteger.ZERO, "amount")).isZero();
    assertThat(Amounts.requireUnsigned(Amounts.MAX_UINT256, "amount")).isEqualTo(Amounts.MAX_UINT256);
  }

  @Test
  void requireUnsigned_rejectsNegative() {
    assertThatThrownBy(() -> Amounts.requireUnsigned(BigInteger.valueOf(-1), "deposit"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("deposit");
  }

  @Test
  void requireUnsigned_rejectsWiderThan256Bits() {
    assertThatThrownBy(() -> Amounts.requireUnsigned(Amounts.MAX_UINT256.add(BigInteger.ONE), "value"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requireUnsigned_rejectsNull() {
    assertThatThrownBy(() -> Amounts.requireUnsigned(null, "value"))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void principal_rejectsBlankIds() {
    assertThatThrownBy(() -> Principal.of(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(Principal.of("alice")).isEqualTo(new Principal("alice"));
    assertThat(Principal.of("alice")).hasToString("alice");
  }
}
