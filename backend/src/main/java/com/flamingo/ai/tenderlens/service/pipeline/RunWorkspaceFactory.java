package com.flamingo.ai.tenderlens.service.pipeline;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import com.flamingo.ai.tenderlens.exception.PipelineException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/** Creates per-run working directories under {@code pipeline.workspace.base-path}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunWorkspaceFactory {

  private static final Pattern UNSAFE_CHARS =
      Pattern.compile("[^\\p{L}\\p{N}._-]+", Pattern.UNICODE_CHARACTER_CLASS);

  private final PipelineConfig pipelineConfig;

  /**
   * Opens a fresh, empty workspace for the run. A directory left over by an earlier run with the
   * same id is deleted first.
   *
   * @throws PipelineException if the directory cannot be prepared
   */
  public RunWorkspace open(String runId) {
    Path base = Paths.get(pipelineConfig.getWorkspace().getBasePath());
    Path root = base.resolve(sanitizeSegment(runId));
    try {
      if (FileSystemUtils.deleteRecursively(root)) {
        log.info("Removed stale workspace {}", root);
      }
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new PipelineException(runId, "Cannot prepare workspace " + root, e);
    }
    log.debug("Opened workspace {}", root);
    return new RunWorkspace(runId, root);
  }

  /** Turns an arbitrary id into a single path segment that cannot escape its parent. */
  static String sanitizeSegment(String value) {
    if (value == null) {
      return "run";
    }
    String safe = UNSAFE_CHARS.matcher(value.strip()).replaceAll("_");
    if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) {
      return "run";
    }
    return safe;
  }
}
