package com.flamingo.ai.tenderlens.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextReductionStats Tests")
class TextReductionStatsTest {

  @Test
  @DisplayName("Should count lines and characters removed")
  void shouldCountReduction() {
    TextReductionStats stats = TextReductionStats.between("a\nb\nc\nd", "a\nb");

    assertThat(stats.originalLines()).isEqualTo(4);
    assertThat(stats.cleanedLines()).isEqualTo(2);
    assertThat(stats.linesRemoved()).isEqualTo(2);
    assertThat(stats.linesReductionPercent()).isEqualTo(50.0);
    assertThat(stats.originalChars()).isEqualTo(7);
    assertThat(stats.cleanedChars()).isEqualTo(3);
    assertThat(stats.charsRemoved()).isEqualTo(4);
    assertThat(stats.charsReductionPercent()).isEqualTo(57.14);
  }

  @Test
  @DisplayName("Should report zero percent for empty original")
  void shouldHandleEmptyOriginal() {
    TextReductionStats stats = TextReductionStats.between("", "");

    assertThat(stats.charsReductionPercent()).isZero();
    assertThat(stats.originalLines()).isEqualTo(1);
    assertThat(stats.linesReductionPercent()).isZero();
  }
}
