package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void resolveKeepsProvidedTraceId() {
    assertThat(TraceIds.resolve("trace-1")).isEqualTo("trace-1");
  }

  @Test
  void resolveGeneratesUuidWhenBlank() {
    final String resolved = TraceIds.resolve("  ");

    assertThat(UUID.fromString(resolved)).isNotNull();
    assertThat(TraceIds.resolve(null)).isNotEqualTo(resolved);
  }
}
