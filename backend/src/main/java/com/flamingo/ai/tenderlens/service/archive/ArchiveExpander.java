package com.flamingo.ai.tenderlens.service.archive;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.service.classification.FilenameClassifier;
import com.flamingo.ai.tenderlens.service.classification.FilenameNormalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Opens zip/rar containers and yields their member files with sanitized names.
 *
 * <p>A failing archive never aborts the batch: any error is logged and the archive contributes no
 * files.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveExpander {

  private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private final PipelineConfig pipelineConfig;
  private final List<ArchiveExtractor> extractors;
  private final FilenameClassifier filenameClassifier;

  /** Whether the extension is one of {@code pipeline.archive.extensions}. */
  public boolean isArchive(Path path) {
    String extension = FilenameNormalizer.extension(path.getFileName().toString());
    return pipelineConfig.getArchive().getExtensions().contains(extension);
  }

  /**
   * Extracts the archive and returns only the members the filename classifier keeps.
   *
   * @param archive archive file
   * @param destination directory to extract into; created if missing
   * @return kept member paths in stable (sorted) order; empty on any failure
   */
  public List<Path> expand(Path archive, Path destination) {
    List<Path> kept = new ArrayList<>();
    for (Path member : extractMembers(archive, destination)) {
      if (filenameClassifier.isUseful(member.getFileName().toString())) {
        log.info("Useful file in archive: {}", member.getFileName());
        kept.add(member);
      } else {
        log.debug("Filtered out in archive: {}", member.getFileName());
      }
    }
    log.info("Archive {} yielded {} useful files", archive.getFileName(), kept.size());
    return kept;
  }

  /**
   * Extracts the archive and returns every member file after name sanitization, without
   * classification.
   *
   * @param archive archive file
   * @param destination directory to extract into; created if missing
   * @return member paths in stable (sorted) order; empty on any failure
   */
  public List<Path> extractMembers(Path archive, Path destination) {
    String extension = FilenameNormalizer.extension(archive.getFileName().toString());
    Optional<ArchiveExtractor> extractor = findExtractor(extension);
    if (extractor.isEmpty()) {
      log.warn("Unsupported archive format: {}", archive.getFileName());
      return List.of();
    }
    if (!extractor.get().isAvailable()) {
      log.error("Archive format .{} is not supported at runtime: {}", extension, archive);
      return List.of();
    }

    try {
      Files.createDirectories(destination);
      log.info("Extracting archive: {}", archive.getFileName());
      extractor.get().extractAll(archive, destination);
      List<Path> members = new ArrayList<>();
      for (Path file : listFiles(destination)) {
        members.add(sanitizeName(file));
      }
      return members;
    } catch (IOException | RuntimeException e) {
      log.error("Failed to process archive {}: {}", archive, e.getMessage());
      return List.of();
    }
  }

  /**
   * Replaces line breaks and control characters in a member name with spaces and squeezes
   * whitespace.
   */
  static String sanitizeFilename(String filename) {
    String clean = CONTROL_CHARS.matcher(filename).replaceAll(" ");
    return WHITESPACE.matcher(clean).replaceAll(" ").strip();
  }

  private Path sanitizeName(Path file) {
    String original = file.getFileName().toString();
    String clean = sanitizeFilename(original);
    if (clean.equals(original) || clean.isEmpty()) {
      return file;
    }
    Path renamed = file.resolveSibling(clean);
    try {
      Files.move(file, renamed);
      log.info("Renamed file: '{}' -> '{}'", original, clean);
      return renamed;
    } catch (IOException e) {
      log.warn("Could not rename file '{}': {}", original, e.getMessage());
      return file;
    }
  }

  private Optional<ArchiveExtractor> findExtractor(String extension) {
    return extractors.stream().filter(e -> e.supports(extension)).findFirst();
  }

  private static List<Path> listFiles(Path root) throws IOException {
    try (Stream<Path> walk = Files.walk(root)) {
      return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }
  }
}
