package com.flamingo.ai.tenderlens.service.cleaning;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Keeps only lines that mention technical vocabulary (dimensions, standards, packaging...). */
@Component
@RequiredArgsConstructor
public class TechnicalInfoExtractor {

  private final PipelineConfig pipelineConfig;

  public String extract(String cleanText) {
    if (cleanText == null || cleanText.isEmpty()) {
      return "";
    }
    List<String> keywords = pipelineConfig.getCleaning().getTechnicalKeywords();
    return cleanText
        .lines()
        .filter(
            line -> {
              String lower = line.toLowerCase(Locale.ROOT);
              return keywords.stream().anyMatch(lower::contains);
            })
        .collect(Collectors.joining("\n"));
  }
}
