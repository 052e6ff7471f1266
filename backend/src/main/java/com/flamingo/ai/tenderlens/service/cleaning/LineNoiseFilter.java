package com.flamingo.ai.tenderlens.service.cleaning;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drops boilerplate, legal and procedural lines from raw extracted text.
 *
 * <p>A line is dropped when, after trimming, it is empty, contains a boilerplate marker, has one of
 * the content-free shapes in {@link #CONTENT_FREE_LINES}, or is shorter than the configured minimum
 * and carries no digit. Retained lines keep their original form and order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LineNoiseFilter {

  private static final int FLAGS =
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

  private static final List<Pattern> CONTENT_FREE_LINES =
      List.of(
          Pattern.compile("^\\s*№\\s*\\d+.*$", FLAGS), // document number
          Pattern.compile("^\\s*\\d+\\.\\s*$", FLAGS), // bare numbered item
          Pattern.compile("^\\s*[а-я]\\.\\s*$", FLAGS), // bare lettered item
          Pattern.compile("^\\s*-\\s*$", FLAGS),
          Pattern.compile("^\\s*\\.\\s*$", FLAGS),
          Pattern.compile("^\\s*,\\s*$", FLAGS),
          Pattern.compile("^\\s*;\\s*$", FLAGS));

  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private final PipelineConfig pipelineConfig;

  public NoiseFilterResult filterNoise(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return new NoiseFilterResult("", 0);
    }
    PipelineConfig.Cleaning rules = pipelineConfig.getCleaning();

    String[] lines = LINE_BREAK.split(rawText);
    List<String> retained = new ArrayList<>();
    int removed = 0;
    for (String line : lines) {
      if (isNoise(line.strip(), rules)) {
        removed++;
        log.trace("Dropped line: {}", line);
        continue;
      }
      retained.add(line);
    }

    String cleaned = String.join("\n", retained);
    log.debug(
        "Line filter removed {} of {} lines, {} -> {} chars",
        removed,
        lines.length,
        rawText.length(),
        cleaned.length());
    return new NoiseFilterResult(cleaned, removed);
  }

  private static boolean isNoise(String line, PipelineConfig.Cleaning rules) {
    if (line.isEmpty()) {
      return true;
    }
    String lower = line.toLowerCase(Locale.ROOT);
    for (String marker : rules.getBoilerplateMarkers()) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    for (Pattern shape : CONTENT_FREE_LINES) {
      if (shape.matcher(line).matches()) {
        return true;
      }
    }
    return line.length() < rules.getShortLineMinLength()
        && line.chars().noneMatch(Character::isDigit);
  }
}
