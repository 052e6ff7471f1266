package com.flamingo.ai.tenderlens.service.classification;

/**
 * Outcome of classifying one filename.
 *
 * @param keep whether the file is worth analyzing
 * @param reason rule that decided
 * @param normalizedName the normalized name the rules were evaluated against
 * @param matchedMarker the include/exclude marker that matched; {@code null} for other reasons
 */
public record ClassificationVerdict(
    boolean keep, ClassificationReason reason, String normalizedName, String matchedMarker) {

  static ClassificationVerdict keep(
      ClassificationReason reason, String normalizedName, String matchedMarker) {
    return new ClassificationVerdict(true, reason, normalizedName, matchedMarker);
  }

  static ClassificationVerdict discard(
      ClassificationReason reason, String normalizedName, String matchedMarker) {
    return new ClassificationVerdict(false, reason, normalizedName, matchedMarker);
  }
}
