package com.flamingo.ai.tenderlens.service.cleaning;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Bounds text to a character budget, preferring a whole-word cut. */
@Component
@Slf4j
public class Truncator {

  /** A word-boundary cut is only taken when it keeps at least this share of the budget. */
  static final double WORD_BOUNDARY_MIN_SHARE = 0.9;

  /**
   * Returns {@code text} unchanged when it fits, otherwise its first {@code maxChars} characters,
   * cut back to the last whitespace when that whitespace lies at or past 90% of the budget. No
   * marker is appended.
   */
  public String truncate(String text, int maxChars) {
    if (maxChars < 0) {
      throw new IllegalArgumentException("maxChars must not be negative: " + maxChars);
    }
    if (text == null) {
      return "";
    }
    if (text.length() <= maxChars) {
      return text;
    }

    String cut = text.substring(0, maxChars);
    int lastSpace = lastWhitespace(cut);
    if (lastSpace >= maxChars * WORD_BOUNDARY_MIN_SHARE) {
      cut = cut.substring(0, lastSpace);
    }
    log.info("Text truncated: {} -> {} chars", text.length(), cut.length());
    return cut;
  }

  private static int lastWhitespace(String text) {
    for (int i = text.length() - 1; i >= 0; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
