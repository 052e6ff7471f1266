package com.flamingo.ai.tenderlens.service.cleaning;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes templated filler from extracted tender text, collapses near-duplicate lines and tags
 * recognized key sections with a bold canonical header.
 *
 * <p>Stages, in order:
 *
 * <ol>
 *   <li>template noise: punctuation/underscore filler, blank signature lines, {@code ИКЗ} codes and
 *       bare "Приложение" lines;
 *   <li>long numbers: standalone digit runs of the configured minimum length are removed;
 *   <li>near duplicates: a line too similar to one of the last accepted lines is dropped, and a
 *       header-like line too similar to a recent header-like line is dropped;
 *   <li>key sections: the first line matching a key-section rule is preceded by its header, once
 *       per text; related lines that do not trigger a header get a bullet;
 *   <li>final sweep: blank-line runs collapsed, filler removed again, text trimmed.
 * </ol>
 */
@Component
@Slf4j
public class StructuralCleaner {

  private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;
  private static final int CI_FLAGS = FLAGS | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  // Symbol-only filler, also re-applied by the final sweep
  private static final Pattern SYMBOL_ONLY = Pattern.compile("^\\s*[«\"»№@_\\-\\s.]+$", FLAGS);
  private static final Pattern SIGNATURE_TEMPLATE =
      Pattern.compile("^\\s*[_\\-\\s]+[«\"»№@\\s]+[_\\-\\s]+$", FLAGS);

  private static final List<LineRule> TEMPLATE_RULES =
      List.of(
          new LineRule(SYMBOL_ONLY, CleaningCounter.NOISE_LINES_REMOVED),
          new LineRule(SIGNATURE_TEMPLATE, CleaningCounter.NOISE_LINES_REMOVED),
          rule("^\\s*[«\"]?_+[\"»]?\\s*$", FLAGS, CleaningCounter.NOISE_LINES_REMOVED),
          rule("^\\s*[«\"]?\\s*_{2,}\\s+[_.]+$", FLAGS, CleaningCounter.NOISE_LINES_REMOVED),
          rule("^\\s*[._]+\\s*$", FLAGS, CleaningCounter.NOISE_LINES_REMOVED),
          rule("^\\s*ИКЗ\\s*:\\s*\\d{15,}\\s*$", FLAGS, CleaningCounter.LONG_NUMBERS_REMOVED),
          rule("^\\s*[«\"»\\s_.]+\\s*$", FLAGS, CleaningCounter.NOISE_LINES_REMOVED),
          rule("^\\s*(Приложение|Приложения)\\s*$", CI_FLAGS, CleaningCounter.NOISE_LINES_REMOVED),
          rule(
              "^\\s*Приложение\\s*№\\s*\\d*\\s*[«\"»№@_\\-\\s.]*$",
              CI_FLAGS,
              CleaningCounter.NOISE_LINES_REMOVED));

  private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n\\s*\\n\\s*\\n+", FLAGS);
  private static final String BULLET = "• ";

  private final PipelineConfig.Cleaning settings;
  private final Pattern longNumber;
  private final List<KeySectionRule> keySections;

  public StructuralCleaner(PipelineConfig pipelineConfig) {
    this.settings = pipelineConfig.getCleaning();
    this.longNumber =
        Pattern.compile("\\b\\d{" + settings.getLongNumberMinDigits() + ",}\\b", FLAGS);
    this.keySections =
        settings.getKeySections().stream()
            .map(
                s ->
                    new KeySectionRule(
                        Pattern.compile(s.getPattern(), FLAGS),
                        s.getHeader(),
                        s.getVocabulary() == null || s.getVocabulary().isBlank()
                            ? null
                            : Pattern.compile(s.getVocabulary(), FLAGS)))
            .toList();
  }

  public CleaningResult cleanAndStructure(String rawText) {
    CleaningStatistics stats = new CleaningStatistics();
    if (rawText == null || rawText.isEmpty()) {
      return new CleaningResult("", stats);
    }
    stats.setOriginalLength(rawText.length());

    String normalized = rawText.replace("\r\n", "\n").replace('\r', '\n');
    List<String> lines = removeTemplateNoise(List.of(normalized.split("\n", -1)), stats);
    lines = stripLongNumbers(lines, stats);
    lines = suppressNearDuplicates(lines, stats);
    lines = tagKeySections(lines, stats);
    String text = finalSweep(lines);

    stats.setCleanedLength(text.length());
    log.debug("Structural cleaning: {} -> {} chars, {}", rawText.length(), text.length(), stats);
    return new CleaningResult(text, stats);
  }

  private List<String> removeTemplateNoise(List<String> lines, CleaningStatistics stats) {
    List<String> kept = new ArrayList<>(lines.size());
    for (String line : lines) {
      LineRule matched = null;
      for (LineRule rule : TEMPLATE_RULES) {
        if (rule.pattern().matcher(line).matches()) {
          matched = rule;
          break;
        }
      }
      if (matched != null) {
        stats.increment(matched.counter());
        continue;
      }
      kept.add(line);
    }
    return kept;
  }

  private List<String> stripLongNumbers(List<String> lines, CleaningStatistics stats) {
    String joined = String.join("\n", lines);
    Matcher matcher = longNumber.matcher(joined);
    int found = 0;
    while (matcher.find()) {
      found++;
    }
    stats.add(CleaningCounter.LONG_NUMBERS_REMOVED, found);
    if (found == 0) {
      return lines;
    }
    return List.of(matcher.reset().replaceAll("").split("\n", -1));
  }

  private List<String> suppressNearDuplicates(List<String> lines, CleaningStatistics stats) {
    List<String> accepted = new ArrayList<>(lines.size());
    for (String line : lines) {
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        accepted.add(line);
        continue;
      }
      if (isNearDuplicate(trimmed, accepted) || isDuplicateHeader(trimmed, accepted)) {
        stats.increment(CleaningCounter.DUPLICATES_REMOVED);
        log.trace("Dropped near-duplicate line: {}", trimmed);
        continue;
      }
      accepted.add(line);
    }
    return accepted;
  }

  private boolean isNearDuplicate(String trimmed, List<String> accepted) {
    int from = Math.max(0, accepted.size() - settings.getNearDuplicateWindow());
    for (String previous : accepted.subList(from, accepted.size())) {
      String other = previous.strip();
      if (!other.isEmpty()
          && SequenceSimilarity.exceeds(trimmed, other, settings.getNearDuplicateThreshold())) {
        return true;
      }
    }
    return false;
  }

  private boolean isDuplicateHeader(String trimmed, List<String> accepted) {
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (!isHeaderLike(lower)) {
      return false;
    }
    int from = Math.max(0, accepted.size() - settings.getHeaderWindow());
    for (String previous : accepted.subList(from, accepted.size())) {
      String other = previous.strip().toLowerCase(Locale.ROOT);
      if (!other.isEmpty()
          && isHeaderLike(other)
          && SequenceSimilarity.exceeds(lower, other, settings.getHeaderThreshold())) {
        return true;
      }
    }
    return false;
  }

  private boolean isHeaderLike(String lower) {
    return keySections.stream().anyMatch(rule -> rule.trigger().matcher(lower).find());
  }

  private List<String> tagKeySections(List<String> lines, CleaningStatistics stats) {
    List<String> structured = new ArrayList<>(lines.size() + 2 * keySections.size());
    Set<String> emitted = new HashSet<>();
    for (String line : lines) {
      String lower = line.strip().toLowerCase(Locale.ROOT);
      KeySectionRule trigger = firstTrigger(lower);
      if (trigger != null) {
        if (emitted.add(trigger.header())) {
          structured.add("");
          structured.add("**" + trigger.header() + "**");
          stats.increment(CleaningCounter.KEY_HEADERS_FOUND);
          log.trace("Key section: {}", trigger.header());
        }
        structured.add(line);
      } else if (!lower.isEmpty() && !lower.startsWith("**") && mentionsKeyVocabulary(lower)) {
        structured.add(BULLET + line);
      } else {
        structured.add(line);
      }
    }
    return structured;
  }

  private KeySectionRule firstTrigger(String lower) {
    if (lower.isEmpty()) {
      return null;
    }
    for (KeySectionRule rule : keySections) {
      if (rule.trigger().matcher(lower).find()) {
        return rule;
      }
    }
    return null;
  }

  private boolean mentionsKeyVocabulary(String lower) {
    return keySections.stream()
        .anyMatch(rule -> rule.vocabulary() != null && rule.vocabulary().matcher(lower).find());
  }

  private String finalSweep(List<String> lines) {
    String text = BLANK_LINE_RUN.matcher(String.join("\n", lines)).replaceAll("\n\n");
    List<String> kept = new ArrayList<>();
    for (String line : text.split("\n", -1)) {
      if (SYMBOL_ONLY.matcher(line).matches() || SIGNATURE_TEMPLATE.matcher(line).matches()) {
        continue;
      }
      kept.add(line);
    }
    return String.join("\n", kept).strip();
  }

  private static LineRule rule(String regex, int flags, CleaningCounter counter) {
    return new LineRule(Pattern.compile(regex, flags), counter);
  }

  private record LineRule(Pattern pattern, CleaningCounter counter) {}

  private record KeySectionRule(Pattern trigger, String header, Pattern vocabulary) {}
}
