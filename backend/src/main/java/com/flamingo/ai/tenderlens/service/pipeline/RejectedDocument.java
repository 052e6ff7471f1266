package com.flamingo.ai.tenderlens.service.pipeline;

/**
 * A file or archive skipped during a run.
 *
 * @param name file name
 * @param reason why it was skipped
 * @param detail free-form detail, e.g. the matched marker; may be {@code null}
 */
public record RejectedDocument(String name, RejectionReason reason, String detail) {}
