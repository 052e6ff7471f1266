package com.flamingo.ai.tenderlens.service.prompt;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.service.cleaning.Truncator;
import com.flamingo.ai.tenderlens.service.pipeline.PipelineResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assembles the analysis prompt from tender data and the pipeline's cleaned text.
 *
 * <p>The prompt never exceeds {@code pipeline.prompt.max-prompt-chars}: the documentation text is
 * bounded first, shrunk further when the rest of the prompt leaves less room, and as a last resort
 * the whole prompt is cut.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenderPromptBuilder {

  static final String TEXT_TRUNCATED = "\n\n[Текст обрезан для экономии токенов]";
  static final String PROMPT_TRUNCATED = "\n\n[Промпт обрезан из-за ограничения по длине]";
  static final int MIN_TEXT_ROOM = 100;

  private static final String TEXT_START = "<<<";
  private static final String TEXT_END = ">>>";

  private final PipelineConfig pipelineConfig;
  private final Truncator truncator;

  public String build(TenderSummary summary, List<TenderItem> items, PipelineResult result) {
    PipelineConfig.Prompt limits = pipelineConfig.getPrompt();
    TenderSummary info = summary == null ? TenderSummary.empty() : summary;
    List<TenderItem> positions = items == null ? List.of() : items;
    String source = result == null || result.text() == null ? "" : result.text();

    String text = bound(source, limits.getMaxTextChars());
    String prompt = render(info, positions, text);
    if (prompt.length() <= limits.getMaxPromptChars()) {
      return prompt;
    }

    int overhead = prompt.length() - text.length();
    int room = limits.getMaxPromptChars() - overhead - TEXT_TRUNCATED.length();
    if (!text.isEmpty() && room > MIN_TEXT_ROOM) {
      String shrunk = truncator.truncate(source, room) + TEXT_TRUNCATED;
      log.info("Prompt over budget, documentation text shrunk to {} chars", room);
      return render(info, positions, shrunk);
    }

    log.warn("Prompt over budget with no room for text, cutting the whole prompt");
    int keep = Math.max(0, limits.getMaxPromptChars() - MIN_TEXT_ROOM);
    return prompt.substring(0, keep) + PROMPT_TRUNCATED;
  }

  private String bound(String text, int maxChars) {
    String bounded = truncator.truncate(text, maxChars);
    return bounded.length() < text.length() ? bounded + TEXT_TRUNCATED : bounded;
  }

  private static String render(TenderSummary summary, List<TenderItem> items, String text) {
    List<String> lines = new ArrayList<>();
    lines.add("🔍 АНАЛИЗ ТЕНДЕРА");
    lines.add("=".repeat(60));
    lines.add("");

    lines.add("🧾 ОБЩАЯ ИНФОРМАЦИЯ:");
    addField(lines, "Номер тендера", summary.number());
    addField(lines, "Название", summary.title());
    addField(lines, "Заказчик", summary.customer());
    addField(lines, "Регион", summary.region());
    if (summary.price() != null && summary.price().signum() != 0) {
      lines.add("• Начальная цена: " + formatPrice(summary.price()) + " ₽");
    }
    addField(lines, "Срок подачи заявок", summary.deadline());
    addField(lines, "Ссылка на тендер", summary.link());
    addField(lines, "Ссылка TenderGuru", summary.aggregatorLink());
    lines.add("");

    if (!items.isEmpty()) {
      lines.add("📦 ПОЗИЦИИ ТОВАРОВ:");
      BigDecimal sum = BigDecimal.ZERO;
      for (TenderItem item : items) {
        BigDecimal total = item.total() == null ? BigDecimal.ZERO : item.total();
        sum = sum.add(total);
        lines.add(
            String.format(
                "• %s — %d шт × %s ₽ = %s ₽",
                item.name() == null ? "Не указано" : item.name(),
                item.quantity(),
                formatPrice(item.price()),
                formatPrice(total)));
      }
      lines.add("• ИТОГО по позициям: " + formatPrice(sum) + " ₽");
      lines.add("");
    }

    if (!text.isEmpty()) {
      lines.add("📄 ИЗВЛЕЧЁННЫЙ ТЕКСТ ИЗ ДОКУМЕНТАЦИИ:");
      lines.add(TEXT_START);
      lines.add(text);
      lines.add(TEXT_END);
      lines.add("");
    }

    lines.add("🎯 Проанализируй тендер и выдай:");
    lines.add("- Основные требования и условия");
    lines.add("- Возможные риски или нестандартные условия");
    lines.add("- Есть ли потенциальные ловушки или завышенные требования");
    lines.add("- Итоговая сводка по тендеру");
    return String.join("\n", lines);
  }

  private static void addField(List<String> lines, String label, String value) {
    if (value != null && !value.isBlank()) {
      lines.add("• " + label + ": " + value);
    }
  }

  /** Two decimals, space as thousands separator: {@code 30727.4} becomes {@code 30 727.40}. */
  static String formatPrice(BigDecimal price) {
    if (price == null) {
      return "Не указана";
    }
    DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
    symbols.setGroupingSeparator(' ');
    symbols.setDecimalSeparator('.');
    DecimalFormat format = new DecimalFormat("#,##0.00", symbols);
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format.format(price);
  }
}
