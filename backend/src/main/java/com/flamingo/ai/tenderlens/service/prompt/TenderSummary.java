package com.flamingo.ai.tenderlens.service.prompt;

import java.math.BigDecimal;
import lombok.Builder;

/**
 * General tender information shown at the top of the prompt. Every field is optional; blank fields
 * are left out of the prompt.
 */
@Builder
public record TenderSummary(
    String number,
    String title,
    String customer,
    String region,
    BigDecimal price,
    String deadline,
    String link,
    String aggregatorLink) {

  public static TenderSummary empty() {
    return TenderSummary.builder().build();
  }
}
