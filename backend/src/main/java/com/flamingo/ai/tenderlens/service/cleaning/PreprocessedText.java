package com.flamingo.ai.tenderlens.service.cleaning;

/**
 * Cleaned and length-bounded text.
 *
 * @param text the final text
 * @param statistics counters of the cleaning pass
 * @param finalLength length of {@code text}
 * @param truncated whether the budget cut anything
 */
public record PreprocessedText(
    String text, CleaningStatistics statistics, int finalLength, boolean truncated) {}
