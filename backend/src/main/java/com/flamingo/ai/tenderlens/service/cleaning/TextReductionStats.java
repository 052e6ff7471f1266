package com.flamingo.ai.tenderlens.service.cleaning;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Line and character counts before and after a cleaning pass. */
public record TextReductionStats(
    int originalLines,
    int cleanedLines,
    int linesRemoved,
    double linesReductionPercent,
    int originalChars,
    int cleanedChars,
    int charsRemoved,
    double charsReductionPercent) {

  public static TextReductionStats between(String original, String cleaned) {
    String before = original == null ? "" : original;
    String after = cleaned == null ? "" : cleaned;
    int originalLines = before.split("\n", -1).length;
    int cleanedLines = after.split("\n", -1).length;
    return new TextReductionStats(
        originalLines,
        cleanedLines,
        originalLines - cleanedLines,
        percent(originalLines - cleanedLines, originalLines),
        before.length(),
        after.length(),
        before.length() - after.length(),
        percent(before.length() - after.length(), before.length()));
  }

  private static double percent(int removed, int total) {
    if (total <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(removed * 100.0 / total)
        .setScale(2, RoundingMode.HALF_EVEN)
        .doubleValue();
  }
}
