package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void orNewKeepsProvidedValue() {
    assertThat(TraceIds.orNew("req-1")).isEqualTo("req-1");
  }

  @Test
  void orNewGeneratesWhenBlank() {
    assertThat(TraceIds.orNew(" ")).isNotBlank();
    assertThat(TraceIds.orNew(null)).hasSize(36);
  }
}
