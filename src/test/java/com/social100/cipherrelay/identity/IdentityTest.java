package com.social100.cipherrelay.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IdentityTest {

  @Test
  void parse_normalizesCaseAndWhitespace() {
    assertThat(Identity.parse("  ab12cd ")).contains(new Identity("AB12CD"));
  }

  @Test
  void parse_rejectsWrongLength() {
    assertThat(Identity.parse("AB12C")).isEmpty();
    assertThat(Identity.parse("AB12CDE")).isEmpty();
    assertThat(Identity.parse("")).isEmpty();
    assertThat(Identity.parse(null)).isEmpty();
  }

  @Test
  void parse_rejectsCharactersOutsideAlphabet() {
    assertThat(Identity.parse("AB-2CD")).isEmpty();
    assertThat(Identity.parse("ÄB12CD")).isEmpty();
  }

  @Test
  void of_invalid_throws() {
    assertThatThrownBy(() -> Identity.of("nope"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nope");
  }

  @Test
  void toString_isTheBareValue() {
    assertThat(Identity.of("XY99ZZ")).hasToString("XY99ZZ");
  }
}
