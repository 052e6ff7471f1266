package com.flamingo.ai.tenderlens.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentRelevanceChecker Tests")
class ContentRelevanceCheckerTest {

  private PipelineConfig pipelineConfig;
  private ContentRelevanceChecker checker;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    checker = new ContentRelevanceChecker(pipelineConfig);
  }

  @Test
  @DisplayName("Should be disabled by default")
  void shouldBeDisabledByDefault() {
    assertThat(checker.isEnabled()).isFalse();
    pipelineConfig.getContentCheck().setEnabled(true);
    assertThat(checker.isEnabled()).isTrue();
  }

  @Test
  @DisplayName("Should find the first marker case-insensitively")
  void shouldFindMarker() {
    assertThat(checker.findMarker("НАИМЕНОВАНИЕ ТОВАРА: бумага")).contains("наименование товара");
    assertThat(checker.isRelevant("Упаковка: коробка")).isTrue();
  }

  @Test
  @DisplayName("Should reject text without markers")
  void shouldRejectTextWithoutMarkers() {
    assertThat(checker.isRelevant("Настоящим сообщаем о переносе совещания")).isFalse();
    assertThat(checker.isRelevant(null)).isFalse();
  }
}
