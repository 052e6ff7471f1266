package com.flamingo.ai.tenderlens.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.exception.PipelineException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RunWorkspaceFactory Tests")
class RunWorkspaceFactoryTest {

  @TempDir Path tempDir;

  private PipelineConfig pipelineConfig;
  private RunWorkspaceFactory factory;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getWorkspace().setBasePath(tempDir.resolve("work").toString());
    factory = new RunWorkspaceFactory(pipelineConfig);
  }

  @Test
  @DisplayName("Should create an empty directory named after the run")
  void shouldCreateWorkspace() {
    try (RunWorkspace workspace = factory.open("0373100000124000001")) {
      assertThat(workspace.exists()).isTrue();
      assertThat(workspace.getRoot()).isEqualTo(tempDir.resolve("work/0373100000124000001"));
      assertThat(workspace.getRunId()).isEqualTo("0373100000124000001");
    }
  }

  @Test
  @DisplayName("Should remove leftovers of an earlier run with the same id")
  void shouldRemoveStaleWorkspace() throws Exception {
    Path stale = tempDir.resolve("work/42/old");
    Files.createDirectories(stale);
    Files.writeString(stale.resolve("left.txt"), "old");

    try (RunWorkspace workspace = factory.open("42")) {
      assertThat(workspace.getRoot()).isEmptyDirectory();
    }
  }

  @Test
  @DisplayName("Should delete the directory and its contents on close")
  void shouldDeleteOnClose() throws Exception {
    RunWorkspace workspace = factory.open("42");
    Path archiveDir = Files.createDirectories(workspace.archiveDirectory("docs"));
    Files.writeString(archiveDir.resolve("ТЗ.docx"), "text");

    workspace.close();

    assertThat(workspace.exists()).isFalse();
    assertThat(tempDir.resolve("work")).isEmptyDirectory();
  }

  @Test
  @DisplayName("Should give archives with the same stem distinct directories")
  void shouldSuffixRepeatedArchiveStems() {
    try (RunWorkspace workspace = factory.open("42")) {
      assertThat(workspace.archiveDirectory("docs").getFileName()).hasToString("docs");
      assertThat(workspace.archiveDirectory("docs").getFileName()).hasToString("docs_1");
      assertThat(workspace.archiveDirectory("docs").getFileName()).hasToString("docs_2");
      assertThat(workspace.archiveDirectory("Документы закупки").getFileName())
          .hasToString("Документы_закупки");
    }
  }

  @Test
  @DisplayName("Should keep run ids inside the base directory")
  void shouldSanitizeSegments() {
    assertThat(RunWorkspaceFactory.sanitizeSegment("../../etc")).isEqualTo(".._.._etc");
    assertThat(RunWorkspaceFactory.sanitizeSegment("..")).isEqualTo("run");
    assertThat(RunWorkspaceFactory.sanitizeSegment("  ")).isEqualTo("run");
    assertThat(RunWorkspaceFactory.sanitizeSegment(null)).isEqualTo("run");
    assertThat(RunWorkspaceFactory.sanitizeSegment(" 42 ")).isEqualTo("42");
  }

  @Test
  @DisplayName("Should fail with the run id when the base path is unusable")
  void shouldFailWhenBasePathIsAFile() throws Exception {
    Path file = Files.writeString(tempDir.resolve("occupied"), "x");
    pipelineConfig.getWorkspace().setBasePath(file.toString());

    assertThatThrownBy(() -> factory.open("42"))
        .isInstanceOf(PipelineException.class)
        .satisfies(e -> assertThat(((PipelineException) e).getRunId()).isEqualTo("42"));
  }
}
