package com.flamingo.ai.tenderlens.service.prompt;

import com.flamingo.ai.tenderlens.service.pipeline.PipelineOrchestrator;
import com.flamingo.ai.tenderlens.service.pipeline.PipelineResult;
import com.flamingo.ai.tenderlens.service.pipeline.RunWorkspace;
import com.flamingo.ai.tenderlens.service.pipeline.RunWorkspaceFactory;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs the pipeline for one tender and turns its text into an analysis prompt. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenderDigestService {

  private final RunWorkspaceFactory workspaceFactory;
  private final PipelineOrchestrator orchestrator;
  private final TenderPromptBuilder promptBuilder;

  /**
   * The working directory lives until the prompt is built and is removed on every path out of this
   * method.
   */
  @Timed(value = "pipeline.digest", description = "Time to run the pipeline and build the prompt")
  public TenderDigest digest(
      String runId, List<Path> paths, TenderSummary summary, List<TenderItem> items) {
    try (RunWorkspace workspace = workspaceFactory.open(runId)) {
      PipelineResult result = orchestrator.run(paths, workspace);
      if (!result.success()) {
        log.warn("No prompt for run {}: {}", runId, result.error());
        return new TenderDigest(result, "");
      }
      String prompt = promptBuilder.build(summary, items, result);
      log.info("Prompt for run {} built: {} chars", runId, prompt.length());
      return new TenderDigest(result, prompt);
    }
  }
}
