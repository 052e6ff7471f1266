package com.flamingo.ai.tenderlens.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String WORKSPACE_UNAVAILABLE = "PIPELINE_001";
  public static final String INVALID_PATH = "VALIDATION_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  /** Run the error belongs to, when there is one. */
  private final String runId;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
