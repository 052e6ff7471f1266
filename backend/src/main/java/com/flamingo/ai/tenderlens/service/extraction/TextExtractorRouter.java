package com.flamingo.ai.tenderlens.service.extraction;

import com.flamingo.ai.tenderlens.service.classification.FilenameNormalizer;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a file to the highest-priority {@link TextExtractor} that supports its extension.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order. Unsupported formats (images that
 * would need OCR, spreadsheets, unknown extensions), blank output and extraction failures all come
 * back as {@link Optional#empty()}: the caller treats them as "skip this file".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  public Optional<String> extract(Path file) {
    String extension = FilenameNormalizer.extension(file.getFileName().toString());
    Optional<TextExtractor> extractor =
        extractors.stream().filter(e -> e.supports(extension)).findFirst();
    if (extractor.isEmpty()) {
      log.info("No text extractor for .{} files: {}", extension, file.getFileName());
      return Optional.empty();
    }

    try {
      String text = extractor.get().extract(file);
      if (text == null || text.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(text);
    } catch (Exception e) {
      log.warn("Text extraction failed for {}: {}", file.getFileName(), e.getMessage());
      return Optional.empty();
    }
  }
}
