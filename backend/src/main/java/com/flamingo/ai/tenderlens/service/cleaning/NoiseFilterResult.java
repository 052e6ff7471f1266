package com.flamingo.ai.tenderlens.service.cleaning;

/**
 * Output of the line-level noise filter.
 *
 * @param text retained lines joined with {@code \n}
 * @param removedLines number of lines dropped, blank lines included
 */
public record NoiseFilterResult(String text, int removedLines) {}
