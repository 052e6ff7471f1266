package com.flamingo.ai.tenderlens.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the tender document pipeline.
 *
 * <p>Every rule list is ordered and its order is the evaluation order: the first matching rule
 * wins. Defaults live in {@link DefaultRules}.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Workspace workspace = new Workspace();
  private Classification classification = new Classification();
  private Extraction extraction = new Extraction();
  private Archive archive = new Archive();
  private Dedup dedup = new Dedup();
  private Cleaning cleaning = new Cleaning();
  private ContentCheck contentCheck = new ContentCheck();
  private Prompt prompt = new Prompt();

  @Getter
  @Setter
  public static class Workspace {
    /** Root directory under which one sub-directory per run is created. */
    private String basePath = "download_files/temp_cleaned";
  }

  @Getter
  @Setter
  public static class Classification {
    private List<String> disallowedExtensions = new ArrayList<>(List.of("xls", "xlsx"));
    private List<String> excludeMarkers = new ArrayList<>(DefaultRules.EXCLUDE_MARKERS);
    private List<String> includeMarkers = new ArrayList<>(DefaultRules.INCLUDE_MARKERS);

    /** Names up to this length made only of letters, digits and spaces are kept as neutral. */
    private int neutralNameMaxLength = 25;
  }

  @Getter
  @Setter
  public static class Extraction {
    private List<String> allowedExtensions = new ArrayList<>(List.of("doc", "docx", "pdf", "txt"));
  }

  @Getter
  @Setter
  public static class Archive {
    private List<String> extensions = new ArrayList<>(List.of("zip", "rar"));

    /** Charset for zip entry names that are not valid UTF-8 (Windows archivers use CP866). */
    private String fallbackCharset = "CP866";
  }

  /** Which of two logically duplicate files survives deduplication. */
  public enum DedupPriority {
    INPUT_ORDER,
    ARCHIVE_FIRST,
    TOP_LEVEL_FIRST
  }

  @Getter
  @Setter
  public static class Dedup {
    private DedupPriority priority = DedupPriority.INPUT_ORDER;
    private String digestAlgorithm = "SHA-256";
  }

  /** Cleaning strategy applied to each extracted document. */
  public enum CleaningMode {
    STRUCTURED,
    LINE_FILTER
  }

  @Getter
  @Setter
  public static class Cleaning {
    private CleaningMode mode = CleaningMode.STRUCTURED;
    private int nearDuplicateWindow = 10;
    private double nearDuplicateThreshold = 0.85;
    private int headerWindow = 5;
    private double headerThreshold = 0.70;
    private int longNumberMinDigits = 15;

    /** Lines shorter than this (after trim) without any digit are dropped by the line filter. */
    private int shortLineMinLength = 10;

    private List<String> boilerplateMarkers = new ArrayList<>(DefaultRules.BOILERPLATE_MARKERS);
    private List<KeySection> keySections = DefaultRules.keySections();
    private List<String> technicalKeywords = new ArrayList<>(DefaultRules.TECHNICAL_KEYWORDS);
  }

  /**
   * One key-section rule. {@code pattern} is searched in the lower-cased line and triggers the
   * {@code header}; {@code vocabulary} marks related lines that do not trigger the header.
   */
  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class KeySection {
    private String pattern;
    private String header;
    private String vocabulary;
  }

  @Getter
  @Setter
  public static class ContentCheck {
    /** Additionally require top-level files to mention technical vocabulary in their text. */
    private boolean enabled = false;

    private List<String> markers = new ArrayList<>(DefaultRules.USEFUL_CONTENT_MARKERS);
  }

  @Getter
  @Setter
  public static class Prompt {
    /** Budget for the documentation text block before the prompt is assembled. */
    private int maxTextChars = 15000;

    /** Hard limit for the whole assembled prompt. */
    private int maxPromptChars = 16000;
  }
}
