package com.flamingo.ai.tenderlens.exception;

/** Thrown when a run cannot be carried out at all, e.g. its working directory is unusable. */
public class PipelineException extends RuntimeException {

  private final String runId;

  public PipelineException(String runId, String message) {
    super(message);
    this.runId = runId;
  }

  public PipelineException(String runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
