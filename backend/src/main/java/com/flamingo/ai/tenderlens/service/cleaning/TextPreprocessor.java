package com.flamingo.ai.tenderlens.service.cleaning;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs the configured cleaning strategy and, on request, the length budget. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextPreprocessor {

  private final PipelineConfig pipelineConfig;
  private final StructuralCleaner structuralCleaner;
  private final LineNoiseFilter lineNoiseFilter;
  private final Truncator truncator;

  /** Cleans one document's text with the strategy selected by {@code pipeline.cleaning.mode}. */
  public CleaningResult clean(String rawText) {
    PipelineConfig.CleaningMode mode = pipelineConfig.getCleaning().getMode();
    if (mode == PipelineConfig.CleaningMode.LINE_FILTER) {
      NoiseFilterResult filtered = lineNoiseFilter.filterNoise(rawText);
      CleaningStatistics stats = new CleaningStatistics();
      stats.add(CleaningCounter.NOISE_LINES_REMOVED, filtered.removedLines());
      stats.setOriginalLength(rawText == null ? 0 : rawText.length());
      stats.setCleanedLength(filtered.text().length());
      return new CleaningResult(filtered.text(), stats);
    }
    return structuralCleaner.cleanAndStructure(rawText);
  }

  public PreprocessedText preprocess(String rawText, int maxChars) {
    log.info("Preprocessing {} chars", rawText == null ? 0 : rawText.length());
    CleaningResult cleaned = clean(rawText);
    String bounded = truncator.truncate(cleaned.text(), maxChars);
    boolean truncated = bounded.length() != cleaned.text().length();
    log.info("Preprocessing finished: {} chars, truncated={}", bounded.length(), truncated);
    return new PreprocessedText(bounded, cleaned.statistics(), bounded.length(), truncated);
  }
}
