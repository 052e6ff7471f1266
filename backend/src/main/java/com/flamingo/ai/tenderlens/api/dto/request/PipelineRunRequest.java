package com.flamingo.ai.tenderlens.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running the pipeline over a batch of files. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequest {

  @NotBlank(message = "Run id is required")
  private String runId;

  /** Files and archives in priority order. */
  @NotEmpty(message = "At least one path is required")
  private List<String> paths;
}
