package com.flamingo.ai.tenderlens.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for classifying filenames without touching any file. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRequest {

  @NotEmpty(message = "At least one filename is required")
  private List<String> filenames;
}
