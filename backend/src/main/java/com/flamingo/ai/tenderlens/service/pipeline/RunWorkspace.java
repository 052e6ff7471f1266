package com.flamingo.ai.tenderlens.service.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/**
 * Working directory owned by one run. Closing it removes the directory with everything extracted
 * into it.
 */
@Slf4j
public class RunWorkspace implements AutoCloseable {

  private final String runId;
  private final Path root;
  private final Set<String> usedNames = new HashSet<>();

  RunWorkspace(String runId, Path root) {
    this.runId = runId;
    this.root = root;
  }

  public String getRunId() {
    return runId;
  }

  public Path getRoot() {
    return root;
  }

  /**
   * Returns a not yet used sub-directory for one archive, named after its stem. A second archive
   * with the same stem gets a numeric suffix.
   */
  public synchronized Path archiveDirectory(String archiveStem) {
    String base = RunWorkspaceFactory.sanitizeSegment(archiveStem);
    String name = base;
    int suffix = 1;
    while (!usedNames.add(name)) {
      name = base + "_" + suffix++;
    }
    return root.resolve(name);
  }

  @Override
  public void close() {
    try {
      if (FileSystemUtils.deleteRecursively(root)) {
        log.debug("Removed workspace {}", root);
      }
    } catch (IOException e) {
      log.warn("Could not remove workspace {}: {}", root, e.getMessage());
    }
  }

  boolean exists() {
    return Files.isDirectory(root);
  }
}
