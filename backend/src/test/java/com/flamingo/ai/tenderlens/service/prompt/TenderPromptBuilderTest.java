package com.flamingo.ai.tenderlens.service.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.service.cleaning.CleaningStatistics;
import com.flamingo.ai.tenderlens.service.cleaning.Truncator;
import com.flamingo.ai.tenderlens.service.pipeline.PipelineResult;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenderPromptBuilder Tests")
class TenderPromptBuilderTest {

  private PipelineConfig pipelineConfig;
  private TenderPromptBuilder builder;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    builder = new TenderPromptBuilder(pipelineConfig, new Truncator());
  }

  private static PipelineResult resultWith(String text) {
    return PipelineResult.success(text, List.of(), new CleaningStatistics(), List.of());
  }

  @Nested
  @DisplayName("Rendering")
  class Rendering {

    @Test
    @DisplayName("Should render summary, items, text and instructions")
    void shouldRenderAllBlocks() {
      TenderSummary summary =
          TenderSummary.builder()
              .number("0373100000124000001")
              .title("Поставка бумаги")
              .customer("Школа № 5")
              .price(new BigDecimal("30727.40"))
              .deadline("20.11.2026")
              .build();
      List<TenderItem> items =
          List.of(
              new TenderItem("Бумага А4", 10, new BigDecimal("300"), new BigDecimal("3000")),
              new TenderItem("Бумага А3", 2, new BigDecimal("500.5"), new BigDecimal("1001")));

      String prompt = builder.build(summary, items, resultWith("Плотность 80 г/м2"));

      assertThat(prompt)
          .startsWith("🔍 АНАЛИЗ ТЕНДЕРА\n" + "=".repeat(60) + "\n\n🧾 ОБЩАЯ ИНФОРМАЦИЯ:\n")
          .contains("• Номер тендера: 0373100000124000001\n")
          .contains("• Заказчик: Школа № 5\n")
          .contains("• Начальная цена: 30 727.40 ₽\n")
          .contains("• Срок подачи заявок: 20.11.2026\n")
          .contains("• Бумага А4 — 10 шт × 300.00 ₽ = 3 000.00 ₽\n")
          .contains("• Бумага А3 — 2 шт × 500.50 ₽ = 1 001.00 ₽\n")
          .contains("• ИТОГО по позициям: 4 001.00 ₽\n")
          .contains("📄 ИЗВЛЕЧЁННЫЙ ТЕКСТ ИЗ ДОКУМЕНТАЦИИ:\n<<<\nПлотность 80 г/м2\n>>>\n")
          .endsWith("- Итоговая сводка по тендеру")
          .doesNotContain("Регион")
          .doesNotContain("Ссылка");
    }

    @Test
    @DisplayName("Should leave out empty blocks and a zero price")
    void shouldLeaveOutEmptyBlocks() {
      TenderSummary summary =
          TenderSummary.builder().title("  ").price(BigDecimal.ZERO).region("Москва").build();

      String prompt = builder.build(summary, null, resultWith(""));

      assertThat(prompt)
          .contains("• Регион: Москва")
          .doesNotContain("Название")
          .doesNotContain("Начальная цена")
          .doesNotContain("ПОЗИЦИИ ТОВАРОВ")
          .doesNotContain("ИЗВЛЕЧЁННЫЙ ТЕКСТ");
    }

    @Test
    @DisplayName("Should accept missing summary and result")
    void shouldAcceptMissingInputs() {
      String prompt = builder.build(null, List.of(), null);

      assertThat(prompt).contains("🧾 ОБЩАЯ ИНФОРМАЦИЯ:").contains("🎯 Проанализируй тендер");
    }
  }

  @Nested
  @DisplayName("Length limits")
  class LengthLimits {

    @Test
    @DisplayName("Should bound the documentation text and mark it")
    void shouldBoundText() {
      pipelineConfig.getPrompt().setMaxTextChars(50);

      String prompt = builder.build(null, List.of(), resultWith("слово ".repeat(40)));

      assertThat(prompt).contains(TenderPromptBuilder.TEXT_TRUNCATED + "\n>>>");
      assertThat(prompt).doesNotContain("слово ".repeat(10));
    }

    @Test
    @DisplayName("Should shrink the text to fit the prompt limit")
    void shouldShrinkTextToFitPrompt() {
      pipelineConfig.getPrompt().setMaxPromptChars(1000);

      String prompt = builder.build(null, List.of(), resultWith("слово ".repeat(400)));

      assertThat(prompt.length()).isLessThanOrEqualTo(1000);
      assertThat(prompt).contains(TenderPromptBuilder.TEXT_TRUNCATED + "\n>>>");
      assertThat(prompt).endsWith("- Итоговая сводка по тендеру");
    }

    @Test
    @DisplayName("Should cut the whole prompt when no room is left for text")
    void shouldCutWholePrompt() {
      pipelineConfig.getPrompt().setMaxPromptChars(200);

      String prompt = builder.build(null, List.of(), resultWith("слово ".repeat(400)));

      assertThat(prompt).endsWith(TenderPromptBuilder.PROMPT_TRUNCATED);
      assertThat(prompt)
          .hasSize(
              200
                  - TenderPromptBuilder.MIN_TEXT_ROOM
                  + TenderPromptBuilder.PROMPT_TRUNCATED.length());
    }

    @Test
    @DisplayName("Should fall back to the marker alone when the limit is tiny")
    void shouldHandleLimitBelowMinimumTextRoom() {
      pipelineConfig.getPrompt().setMaxPromptChars(50);

      String prompt = builder.build(null, List.of(), resultWith("слово ".repeat(400)));

      assertThat(prompt).isEqualTo(TenderPromptBuilder.PROMPT_TRUNCATED);
    }
  }

  @Test
  @DisplayName("Should format prices with space grouping and two decimals")
  void shouldFormatPrices() {
    assertThat(TenderPromptBuilder.formatPrice(new BigDecimal("30727.40"))).isEqualTo("30 727.40");
    assertThat(TenderPromptBuilder.formatPrice(new BigDecimal("1234567.005")))
        .isEqualTo("1 234 567.01");
    assertThat(TenderPromptBuilder.formatPrice(BigDecimal.ZERO)).isEqualTo("0.00");
    assertThat(TenderPromptBuilder.formatPrice(null)).isEqualTo("Не указана");
  }
}
