package com.flamingo.ai.tenderlens.service.cleaning;

/**
 * Cleaned text of one document together with what cleaning removed.
 *
 * @param text cleaned text, trimmed; empty when nothing useful survived
 * @param statistics counters and lengths for this text
 */
public record CleaningResult(String text, CleaningStatistics statistics) {}
