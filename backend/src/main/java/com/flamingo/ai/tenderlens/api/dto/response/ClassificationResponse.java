package com.flamingo.ai.tenderlens.api.dto.response;

import com.flamingo.ai.tenderlens.service.classification.ClassificationReason;
import com.flamingo.ai.tenderlens.service.classification.ClassificationVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one classified filename. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResponse {

  private String filename;
  private String normalizedName;
  private boolean keep;
  private ClassificationReason reason;
  private String matchedMarker;

  public static ClassificationResponse fromVerdict(String filename, ClassificationVerdict verdict) {
    return ClassificationResponse.builder()
        .filename(filename)
        .normalizedName(verdict.normalizedName())
        .keep(verdict.keep())
        .reason(verdict.reason())
        .matchedMarker(verdict.matchedMarker())
        .build();
  }
}
