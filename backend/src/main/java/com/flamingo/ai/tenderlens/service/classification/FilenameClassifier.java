package com.flamingo.ai.tenderlens.service.classification;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides from a filename alone whether a tender attachment is worth analyzing.
 *
 * <p>Evaluation order is fixed:
 *
 * <ol>
 *   <li>disallowed (spreadsheet) extensions are discarded;
 *   <li>any exclude marker discards, even when an include marker is present too;
 *   <li>any include marker keeps;
 *   <li>a short name made only of letters, digits and spaces is kept as neutral ({@code 123.pdf});
 *   <li>everything else is discarded.
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilenameClassifier {

  private final PipelineConfig pipelineConfig;

  public boolean isUseful(String filename) {
    return classify(filename).keep();
  }

  public ClassificationVerdict classify(String filename) {
    PipelineConfig.Classification rules = pipelineConfig.getClassification();
    String name = FilenameNormalizer.normalize(filename);

    String extension = FilenameNormalizer.extension(filename);
    if (rules.getDisallowedExtensions().contains(extension)) {
      log.debug("Filtered out (disallowed extension): {}", filename);
      return ClassificationVerdict.discard(ClassificationReason.DISALLOWED_EXTENSION, name, null);
    }

    Optional<String> excluded = firstContained(name, rules.getExcludeMarkers());
    if (excluded.isPresent()) {
      log.debug("Filtered out (exclude marker '{}'): {} -> '{}'", excluded.get(), filename, name);
      return ClassificationVerdict.discard(
          ClassificationReason.EXCLUDE_MARKER, name, excluded.get());
    }

    Optional<String> included = firstContained(name, rules.getIncludeMarkers());
    if (included.isPresent()) {
      log.info("Accepted (include marker '{}'): {} -> '{}'", included.get(), filename, name);
      return ClassificationVerdict.keep(ClassificationReason.INCLUDE_MARKER, name, included.get());
    }

    if (name.length() <= rules.getNeutralNameMaxLength() && isAlphanumeric(name.replace(" ", ""))) {
      log.info("Accepted (short neutral name): {} -> '{}'", filename, name);
      return ClassificationVerdict.keep(ClassificationReason.NEUTRAL_SHORT_NAME, name, null);
    }

    log.debug("Filtered out (uninformative name): {} -> '{}'", filename, name);
    return ClassificationVerdict.discard(ClassificationReason.UNINFORMATIVE_NAME, name, null);
  }

  private static Optional<String> firstContained(String name, List<String> markers) {
    return markers.stream().filter(name::contains).findFirst();
  }

  private static boolean isAlphanumeric(String value) {
    if (value.isEmpty()) {
      return false;
    }
    return value.codePoints().allMatch(Character::isLetterOrDigit);
  }
}
