package com.flamingo.ai.tenderlens.service.dedup;

import com.flamingo.ai.tenderlens.service.classification.FilenameNormalizer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drops files that are byte-identical or name-equivalent to a file already accepted.
 *
 * <p>First seen wins: the input order decides which of two duplicates survives. The fingerprint is
 * checked before the normalized name. Each call starts from empty key sets, so one call is one
 * pipeline run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentDeduplicator {

  private final ContentFingerprinter fingerprinter;

  public List<Path> dedupe(List<Path> paths) {
    return dedupe(paths, Function.identity()).unique();
  }

  /**
   * Deduplicates arbitrary items that resolve to a file.
   *
   * @param items items in priority order
   * @param pathOf maps an item to its file
   * @return unique items in input order plus the dropped ones with the reason
   */
  public <T> Deduplication<T> dedupe(List<T> items, Function<T, Path> pathOf) {
    Set<String> seenFingerprints = new HashSet<>();
    Set<String> seenNames = new HashSet<>();
    List<T> unique = new ArrayList<>();
    List<Dropped<T>> dropped = new ArrayList<>();

    for (T item : items) {
      Path path = pathOf.apply(item);
      String fileName = path.getFileName().toString();
      String normalizedName = FilenameNormalizer.normalize(fileName);

      String fingerprint;
      try {
        fingerprint = fingerprinter.fingerprint(path);
      } catch (IOException | RuntimeException e) {
        log.warn("Could not read file {}: {}", path, e.getMessage());
        dropped.add(new Dropped<>(item, DuplicateKind.UNREADABLE));
        continue;
      }

      if (seenFingerprints.contains(fingerprint)) {
        log.info("Duplicate by content: {}", fileName);
        dropped.add(new Dropped<>(item, DuplicateKind.SAME_CONTENT));
        continue;
      }
      if (seenNames.contains(normalizedName)) {
        log.info("Duplicate by name: {}", fileName);
        dropped.add(new Dropped<>(item, DuplicateKind.SAME_NAME));
        continue;
      }

      seenFingerprints.add(fingerprint);
      seenNames.add(normalizedName);
      unique.add(item);
    }

    log.info("After deduplication: {} of {} files", unique.size(), items.size());
    return new Deduplication<>(List.copyOf(unique), List.copyOf(dropped));
  }

  /**
   * Result of one deduplication pass.
   *
   * @param unique surviving items in input order
   * @param dropped one entry per dropped item in input order, repeated items included
   */
  public record Deduplication<T>(List<T> unique, List<Dropped<T>> dropped) {}

  /** A dropped item with the reason it was dropped. */
  public record Dropped<T>(T item, DuplicateKind kind) {}
}
