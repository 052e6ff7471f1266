package com.flamingo.ai.tenderlens.service.extraction;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts one document file into plain text.
 *
 * <p>Implementations are format-specific and stateless. They only extract: filtering and cleaning
 * happen downstream.
 */
public interface TextExtractor {

  /**
   * Returns {@code true} if this extractor can handle the given extension.
   *
   * @param extension lower-cased extension without the dot
   * @return {@code true} if supported
   */
  boolean supports(String extension);

  /**
   * Extracts the text of {@code file}.
   *
   * @param file document to read
   * @return extracted text, possibly blank
   * @throws IOException if the file cannot be read or parsed
   */
  String extract(Path file) throws IOException;
}
