package com.flamingo.ai.tenderlens.service.pipeline;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.service.archive.ArchiveExpander;
import com.flamingo.ai.tenderlens.service.classification.ClassificationReason;
import com.flamingo.ai.tenderlens.service.classification.ClassificationVerdict;
import com.flamingo.ai.tenderlens.service.classification.FilenameClassifier;
import com.flamingo.ai.tenderlens.service.classification.FilenameNormalizer;
import com.flamingo.ai.tenderlens.service.cleaning.CleaningResult;
import com.flamingo.ai.tenderlens.service.cleaning.CleaningStatistics;
import com.flamingo.ai.tenderlens.service.cleaning.ContentRelevanceChecker;
import com.flamingo.ai.tenderlens.service.cleaning.TextPreprocessor;
import com.flamingo.ai.tenderlens.service.dedup.ContentDeduplicator;
import com.flamingo.ai.tenderlens.service.dedup.DuplicateKind;
import com.flamingo.ai.tenderlens.service.extraction.TextExtractorRouter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns one tender's batch of downloaded files and archives into a single cleaned text.
 *
 * <p>Processing is sequential and order-preserving: archives are expanded in place, every collected
 * file is screened by extension and name, duplicates are dropped first-seen-wins, and the survivors
 * are extracted and cleaned in order. Problems with individual files are recorded as rejections and
 * never abort the run; the run fails only when no file produced text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

  static final String NO_USABLE_DOCUMENTS = "No usable documents after filtering and cleaning";

  private final PipelineConfig pipelineConfig;
  private final RunWorkspaceFactory workspaceFactory;
  private final ArchiveExpander archiveExpander;
  private final FilenameClassifier filenameClassifier;
  private final ContentDeduplicator deduplicator;
  private final TextExtractorRouter textExtractor;
  private final TextPreprocessor textPreprocessor;
  private final ContentRelevanceChecker relevanceChecker;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the pipeline in a fresh working directory that is removed before returning.
   *
   * @param paths files and archives, in the order that decides duplicate priority
   * @param runId identifier of the batch, e.g. the tender number
   * @return the run result; never {@code null}
   */
  @Timed(value = "pipeline.run", description = "Time to filter, deduplicate and clean a batch")
  public PipelineResult run(List<Path> paths, String runId) {
    try (RunWorkspace workspace = workspaceFactory.open(runId)) {
      return run(paths, workspace);
    }
  }

  /** Runs the pipeline inside a workspace owned by the caller. */
  public PipelineResult run(List<Path> paths, RunWorkspace workspace) {
    log.info("=== Pipeline run {} started: {} inputs ===", workspace.getRunId(), paths.size());
    List<RejectedDocument> rejected = new ArrayList<>();

    List<DocumentReference> collected = collect(paths, workspace, rejected);
    List<DocumentReference> screened = screen(collected, rejected);
    List<DocumentReference> unique = deduplicate(prioritize(screened), rejected);

    CleaningStatistics totals = new CleaningStatistics();
    List<String> texts = new ArrayList<>();
    List<SourceProvenance> sources = new ArrayList<>();
    int originalLength = 0;

    for (DocumentReference document : unique) {
      try {
        Optional<CleanedDocument> cleaned = process(document, rejected);
        if (cleaned.isPresent()) {
          CleaningResult result = cleaned.get().result();
          texts.add(result.text());
          sources.add(
              new SourceProvenance(
                  document.displayName(), result.text().length(), cleaned.get().originalLength()));
          totals.merge(result.statistics());
          originalLength += cleaned.get().originalLength();
          log.info("Added {} ({} chars)", document.displayName(), result.text().length());
        }
      } catch (RuntimeException e) {
        log.error("Unexpected failure processing {}", document.displayName(), e);
        reject(rejected, document.displayName(), RejectionReason.UNREADABLE, e.getMessage());
      }
    }

    if (texts.isEmpty()) {
      log.warn(
          "=== Pipeline run {} failed: no usable documents ({} rejected) ===",
          workspace.getRunId(),
          rejected.size());
      meterRegistry.counter("pipeline.run.failure").increment();
      return PipelineResult.failure(NO_USABLE_DOCUMENTS, totals, rejected);
    }

    String text = String.join("\n\n", texts);
    totals.setOriginalLength(originalLength);
    totals.setCleanedLength(text.length());
    log.info(
        "=== Pipeline run {} finished: {} sources, {} chars, {} rejected, {} ===",
        workspace.getRunId(),
        sources.size(),
        text.length(),
        rejected.size(),
        totals);
    meterRegistry.counter("pipeline.run.success").increment();
    return PipelineResult.success(text, sources, totals, rejected);
  }

  private List<DocumentReference> collect(
      List<Path> paths, RunWorkspace workspace, List<RejectedDocument> rejected) {
    List<DocumentReference> collected = new ArrayList<>();
    for (Path path : paths) {
      if (path == null || !Files.isRegularFile(path)) {
        log.warn("File not found: {}", path);
        reject(rejected, String.valueOf(path), RejectionReason.MISSING, null);
        continue;
      }
      if (!archiveExpander.isArchive(path)) {
        collected.add(DocumentReference.topLevel(path));
        continue;
      }

      String name = path.getFileName().toString();
      Path destination = workspace.archiveDirectory(stem(name));
      List<Path> members = archiveExpander.extractMembers(path, destination);
      if (members.isEmpty()) {
        reject(rejected, name, RejectionReason.ARCHIVE_FAILED, "no files extracted");
        continue;
      }
      log.info("Archive {} expanded to {} files", name, members.size());
      members.forEach(member -> collected.add(DocumentReference.archiveMember(member)));
    }
    return collected;
  }

  private List<DocumentReference> screen(
      List<DocumentReference> documents, List<RejectedDocument> rejected) {
    List<String> allowed = pipelineConfig.getExtraction().getAllowedExtensions();
    List<DocumentReference> screened = new ArrayList<>();
    for (DocumentReference document : documents) {
      String extension = FilenameNormalizer.extension(document.displayName());
      if (!allowed.contains(extension)) {
        log.info("Ignored by extension: {}", document.displayName());
        reject(rejected, document.displayName(), RejectionReason.DISALLOWED_EXTENSION, extension);
        continue;
      }
      ClassificationVerdict verdict = filenameClassifier.classify(document.displayName());
      if (!verdict.keep()) {
        RejectionReason reason =
            verdict.reason() == ClassificationReason.DISALLOWED_EXTENSION
                ? RejectionReason.DISALLOWED_EXTENSION
                : RejectionReason.NOT_USEFUL;
        String detail =
            verdict.matchedMarker() == null
                ? verdict.reason().name()
                : verdict.reason().name() + ": " + verdict.matchedMarker();
        reject(rejected, document.displayName(), reason, detail);
        continue;
      }
      screened.add(document);
    }
    log.info("Screening kept {} of {} files", screened.size(), documents.size());
    return screened;
  }

  private List<DocumentReference> prioritize(List<DocumentReference> documents) {
    Comparator<DocumentReference> archiveFirst =
        Comparator.comparing(document -> !document.fromArchive());
    return switch (pipelineConfig.getDedup().getPriority()) {
      case ARCHIVE_FIRST -> documents.stream().sorted(archiveFirst).toList();
      case TOP_LEVEL_FIRST -> documents.stream().sorted(archiveFirst.reversed()).toList();
      case INPUT_ORDER -> documents;
    };
  }

  private List<DocumentReference> deduplicate(
      List<DocumentReference> documents, List<RejectedDocument> rejected) {
    ContentDeduplicator.Deduplication<DocumentReference> result =
        deduplicator.dedupe(documents, DocumentReference::path);
    for (ContentDeduplicator.Dropped<DocumentReference> dropped : result.dropped()) {
      reject(rejected, dropped.item().displayName(), toReason(dropped.kind()), null);
    }
    return result.unique();
  }

  private Optional<CleanedDocument> process(
      DocumentReference document, List<RejectedDocument> rejected) {
    Optional<String> extracted = textExtractor.extract(document.path());
    if (extracted.isEmpty()) {
      log.info("No text extracted from {}", document.displayName());
      reject(rejected, document.displayName(), RejectionReason.NO_TEXT, null);
      return Optional.empty();
    }
    String text = extracted.get();

    if (relevanceChecker.isEnabled()
        && !document.fromArchive()
        && !relevanceChecker.isRelevant(text)) {
      log.info("Filtered by content: {}", document.displayName());
      reject(rejected, document.displayName(), RejectionReason.IRRELEVANT_CONTENT, null);
      return Optional.empty();
    }

    CleaningResult cleaned = textPreprocessor.clean(text);
    if (cleaned.text().isBlank()) {
      log.info("Nothing left after cleaning {}", document.displayName());
      reject(rejected, document.displayName(), RejectionReason.EMPTY_AFTER_CLEANING, null);
      return Optional.empty();
    }
    return Optional.of(new CleanedDocument(cleaned, text.length()));
  }

  private void reject(
      List<RejectedDocument> rejected, String name, RejectionReason reason, String detail) {
    rejected.add(new RejectedDocument(name, reason, detail));
    meterRegistry.counter("pipeline.files.skipped", "reason", reason.name()).increment();
  }

  private static RejectionReason toReason(DuplicateKind kind) {
    return switch (kind) {
      case SAME_CONTENT -> RejectionReason.DUPLICATE_CONTENT;
      case SAME_NAME -> RejectionReason.DUPLICATE_NAME;
      case UNREADABLE -> RejectionReason.UNREADABLE;
    };
  }

  private static String stem(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private record CleanedDocument(CleaningResult result, int originalLength) {}
}
