package com.flamingo.ai.tenderlens.service.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ContentDeduplicator Tests")
class ContentDeduplicatorTest {

  @TempDir Path tempDir;

  private ContentDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    deduplicator = new ContentDeduplicator(new ContentFingerprinter(new PipelineConfig()));
  }

  @Test
  @DisplayName("Should keep the first of two byte-identical files")
  void shouldKeepFirstOfIdenticalContent() throws IOException {
    Path first = write("a/Техническое задание.docx", "same bytes");
    Path second = write("b/Копия ТЗ.docx", "same bytes");

    ContentDeduplicator.Deduplication<Path> result =
        deduplicator.dedupe(List.of(first, second), path -> path);

    assertThat(result.unique()).containsExactly(first);
    assertThat(result.dropped())
        .containsExactly(new ContentDeduplicator.Dropped<>(second, DuplicateKind.SAME_CONTENT));
  }

  @Test
  @DisplayName("Should keep the first of two files with equal normalized names")
  void shouldKeepFirstOfEqualNames() throws IOException {
    Path first = write("a/Техническое_задание.docx", "version one");
    Path second = write("b/техническое-задание.pdf", "version two");

    ContentDeduplicator.Deduplication<Path> result =
        deduplicator.dedupe(List.of(first, second), path -> path);

    assertThat(result.unique()).containsExactly(first);
    assertThat(result.dropped())
        .containsExactly(new ContentDeduplicator.Dropped<>(second, DuplicateKind.SAME_NAME));
  }

  @Test
  @DisplayName("Should report content match before name match")
  void shouldCheckFingerprintFirst() throws IOException {
    Path first = write("a/spec.docx", "same bytes");
    Path second = write("b/spec.docx", "same bytes");

    ContentDeduplicator.Deduplication<Path> result =
        deduplicator.dedupe(List.of(first, second), path -> path);

    assertThat(result.dropped())
        .containsExactly(new ContentDeduplicator.Dropped<>(second, DuplicateKind.SAME_CONTENT));
  }

  @Test
  @DisplayName("Should let input order decide which duplicate survives")
  void shouldRespectInputOrder() throws IOException {
    Path first = write("a/one.txt", "same bytes");
    Path second = write("b/two.txt", "same bytes");

    assertThat(deduplicator.dedupe(List.of(second, first))).containsExactly(second);
  }

  @Test
  @DisplayName("Should be idempotent")
  void shouldBeIdempotent() throws IOException {
    List<Path> input =
        List.of(
            write("a/ТЗ.docx", "one"),
            write("b/ТЗ.docx", "two"),
            write("c/Спецификация.pdf", "one"),
            write("d/000000001.pdf", "three"));

    List<Path> once = deduplicator.dedupe(input);
    List<Path> twice = deduplicator.dedupe(once);

    assertThat(once).hasSize(2);
    assertThat(twice).isEqualTo(once);
  }

  @Test
  @DisplayName("Should skip unreadable files without failing")
  void shouldSkipUnreadableFiles() throws IOException {
    Path missing = tempDir.resolve("missing.pdf");
    Path present = write("present.pdf", "content");

    ContentDeduplicator.Deduplication<Path> result =
        deduplicator.dedupe(List.of(missing, present), path -> path);

    assertThat(result.unique()).containsExactly(present);
    assertThat(result.dropped())
        .containsExactly(new ContentDeduplicator.Dropped<>(missing, DuplicateKind.UNREADABLE));
  }

  @Test
  @DisplayName("Should report every repeat of the same file separately")
  void shouldReportEachRepeatOfSameFile() throws IOException {
    Path file = write("ТЗ.docx", "same bytes");

    ContentDeduplicator.Deduplication<Path> result =
        deduplicator.dedupe(List.of(file, file, file), path -> path);

    assertThat(result.unique()).containsExactly(file);
    assertThat(result.dropped())
        .containsExactly(
            new ContentDeduplicator.Dropped<>(file, DuplicateKind.SAME_CONTENT),
            new ContentDeduplicator.Dropped<>(file, DuplicateKind.SAME_CONTENT));
  }

  private Path write(String relative, String content) throws IOException {
    Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content, StandardCharsets.UTF_8);
  }
}
