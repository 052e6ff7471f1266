package com.flamingo.ai.tenderlens.service.pipeline;

/**
 * One file that contributed text to a run.
 *
 * @param filename file name
 * @param length length of its cleaned text
 * @param originalLength length of its extracted text before cleaning
 */
public record SourceProvenance(String filename, int length, int originalLength) {}
