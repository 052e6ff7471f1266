package com.flamingo.ai.tenderlens.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextPreprocessor Tests")
class TextPreprocessorTest {

  private PipelineConfig pipelineConfig;
  private TextPreprocessor preprocessor;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    preprocessor =
        new TextPreprocessor(
            pipelineConfig,
            new StructuralCleaner(pipelineConfig),
            new LineNoiseFilter(pipelineConfig),
            new Truncator());
  }

  @Test
  @DisplayName("Should clean structurally by default")
  void shouldCleanStructurallyByDefault() {
    CleaningResult result =
        preprocessor.clean("__________\nСрок поставки: 10 дней с момента заключения");

    assertThat(result.text())
        .isEqualTo("**Срок поставки**\nСрок поставки: 10 дней с момента заключения");
    assertThat(result.statistics().getNoiseLinesRemoved()).isEqualTo(1);
    assertThat(result.statistics().getKeyHeadersFound()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should use the line filter when configured")
  void shouldUseLineFilterWhenConfigured() {
    pipelineConfig.getCleaning().setMode(PipelineConfig.CleaningMode.LINE_FILTER);
    String raw = "Бумага офисная белая А4\nПодпись\n-\nПлотность 80 г/м2";

    CleaningResult result = preprocessor.clean(raw);

    assertThat(result.text()).isEqualTo("Бумага офисная белая А4\nПлотность 80 г/м2");
    assertThat(result.statistics().getNoiseLinesRemoved()).isEqualTo(2);
    assertThat(result.statistics().getOriginalLength()).isEqualTo(raw.length());
    assertThat(result.statistics().getCleanedLength()).isEqualTo(result.text().length());
  }

  @Test
  @DisplayName("Should report truncation after cleaning")
  void shouldReportTruncation() {
    PreprocessedText result =
        preprocessor.preprocess("Бумага офисная формата А4, белизна 146 процентов", 20);

    assertThat(result.truncated()).isTrue();
    assertThat(result.finalLength()).isEqualTo(result.text().length());
    assertThat(result.text().length()).isLessThanOrEqualTo(20);
  }

  @Test
  @DisplayName("Should not flag text within budget as truncated")
  void shouldNotFlagShortText() {
    PreprocessedText result = preprocessor.preprocess("Бумага офисная формата А4", 15000);

    assertThat(result.truncated()).isFalse();
    assertThat(result.text()).isEqualTo("Бумага офисная формата А4");
  }
}
