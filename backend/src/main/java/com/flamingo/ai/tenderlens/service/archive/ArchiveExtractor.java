package com.flamingo.ai.tenderlens.service.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Unpacks one container format into a directory.
 *
 * <p>Implementations are stateless. {@link ArchiveExpander} picks the first extractor whose {@link
 * #supports} returns {@code true} and skips the archive when that extractor is not {@link
 * #isAvailable() available}.
 */
public interface ArchiveExtractor {

  /**
   * Returns {@code true} if this extractor handles the given extension.
   *
   * @param extension lower-cased extension without the dot
   * @return {@code true} if supported
   */
  boolean supports(String extension);

  /** Whether the library backing this format is present at runtime. */
  default boolean isAvailable() {
    return true;
  }

  /**
   * Extracts every member of {@code archive} below {@code destination}.
   *
   * @param archive archive file
   * @param destination existing directory to extract into
   * @throws IOException if the archive cannot be read or a member cannot be written
   */
  void extractAll(Path archive, Path destination) throws IOException;
}
