package com.flamingo.ai.tenderlens.api.dto.request;

import com.flamingo.ai.tenderlens.service.prompt.TenderItem;
import com.flamingo.ai.tenderlens.service.prompt.TenderSummary;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running the pipeline and building the analysis prompt. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestRequest {

  @NotBlank(message = "Run id is required")
  private String runId;

  @NotEmpty(message = "At least one path is required")
  private List<String> paths;

  private TenderSummary summary;

  private List<TenderItem> items;
}
