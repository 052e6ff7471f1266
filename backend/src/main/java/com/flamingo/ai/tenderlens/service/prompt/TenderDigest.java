package com.flamingo.ai.tenderlens.service.prompt;

import com.flamingo.ai.tenderlens.service.pipeline.PipelineResult;

/**
 * Pipeline result together with the analysis prompt built from it.
 *
 * @param pipelineResult the run result
 * @param prompt the assembled prompt; empty when the run failed
 */
public record TenderDigest(PipelineResult pipelineResult, String prompt) {}
