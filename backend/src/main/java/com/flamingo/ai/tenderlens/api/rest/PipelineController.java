package com.flamingo.ai.tenderlens.api.rest;

import com.flamingo.ai.tenderlens.api.dto.request.ClassificationRequest;
import com.flamingo.ai.tenderlens.api.dto.request.DigestRequest;
import com.flamingo.ai.tenderlens.api.dto.request.PipelineRunRequest;
import com.flamingo.ai.tenderlens.api.dto.response.ClassificationResponse;
import com.flamingo.ai.tenderlens.service.classification.FilenameClassifier;
import com.flamingo.ai.tenderlens.service.pipeline.PipelineOrchestrator;
import com.flamingo.ai.tenderlens.service.pipeline.PipelineResult;
import com.flamingo.ai.tenderlens.service.prompt.TenderDigest;
import com.flamingo.ai.tenderlens.service.prompt.TenderDigestService;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for operator-triggered pipeline runs. */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

  private final PipelineOrchestrator orchestrator;
  private final TenderDigestService digestService;
  private final FilenameClassifier filenameClassifier;

  /** Runs the pipeline; a run without usable documents is still a 200 with success=false. */
  @PostMapping("/runs")
  public ResponseEntity<PipelineResult> run(@Valid @RequestBody PipelineRunRequest request) {
    return ResponseEntity.ok(orchestrator.run(toPaths(request.getPaths()), request.getRunId()));
  }

  /** Runs the pipeline and builds the analysis prompt. */
  @PostMapping("/digests")
  public ResponseEntity<TenderDigest> digest(@Valid @RequestBody DigestRequest request) {
    TenderDigest digest =
        digestService.digest(
            request.getRunId(),
            toPaths(request.getPaths()),
            request.getSummary(),
            request.getItems());
    return ResponseEntity.ok(digest);
  }

  /** Classifies filenames only. */
  @PostMapping("/classifications")
  public ResponseEntity<List<ClassificationResponse>> classify(
      @Valid @RequestBody ClassificationRequest request) {
    List<ClassificationResponse> responses =
        request.getFilenames().stream()
            .map(
                name -> ClassificationResponse.fromVerdict(name, filenameClassifier.classify(name)))
            .toList();
    return ResponseEntity.ok(responses);
  }

  private static List<Path> toPaths(List<String> paths) {
    // null entries reach the orchestrator, which records them as missing
    return paths.stream().map(path -> path == null ? null : Paths.get(path)).toList();
  }
}
