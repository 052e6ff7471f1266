package com.flamingo.ai.tenderlens.service.cleaning;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Decides by extracted text whether a document carries technical requirements at all. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentRelevanceChecker {

  private final PipelineConfig pipelineConfig;

  public boolean isEnabled() {
    return pipelineConfig.getContentCheck().isEnabled();
  }

  /** Returns the first configured marker found in the text, if any. */
  public Optional<String> findMarker(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return pipelineConfig.getContentCheck().getMarkers().stream()
        .filter(lower::contains)
        .findFirst();
  }

  public boolean isRelevant(String text) {
    Optional<String> marker = findMarker(text);
    if (marker.isPresent()) {
      log.debug("Content is relevant, marker '{}'", marker.get());
      return true;
    }
    log.debug("Content has no technical markers");
    return false;
  }
}
