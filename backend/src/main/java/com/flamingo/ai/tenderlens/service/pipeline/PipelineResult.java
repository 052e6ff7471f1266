package com.flamingo.ai.tenderlens.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.tenderlens.service.cleaning.CleaningStatistics;
import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * <p>A run fails only when no file produced text; partial success is success. On failure {@code
 * text} is empty, {@code sources} is empty and {@code error} explains why.
 *
 * @param success whether any file produced text
 * @param text cleaned texts joined by a blank line, in processing order
 * @param length length of {@code text}
 * @param sources contributing files in processing order
 * @param statistics cleaning counters summed over the contributing files
 * @param rejected everything skipped, in the order it was skipped
 * @param error failure reason; {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(
    boolean success,
    String text,
    int length,
    List<SourceProvenance> sources,
    CleaningStatistics statistics,
    List<RejectedDocument> rejected,
    String error) {

  public static PipelineResult success(
      String text,
      List<SourceProvenance> sources,
      CleaningStatistics statistics,
      List<RejectedDocument> rejected) {
    return new PipelineResult(
        true, text, text.length(), List.copyOf(sources), statistics, List.copyOf(rejected), null);
  }

  public static PipelineResult failure(
      String error, CleaningStatistics statistics, List<RejectedDocument> rejected) {
    return new PipelineResult(false, "", 0, List.of(), statistics, List.copyOf(rejected), error);
  }
}
