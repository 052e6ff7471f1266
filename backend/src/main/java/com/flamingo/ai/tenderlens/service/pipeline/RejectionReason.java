package com.flamingo.ai.tenderlens.service.pipeline;

/** Why a file or archive contributed nothing to a run. */
public enum RejectionReason {
  MISSING,
  DISALLOWED_EXTENSION,
  NOT_USEFUL,
  IRRELEVANT_CONTENT,
  DUPLICATE_CONTENT,
  DUPLICATE_NAME,
  UNREADABLE,
  NO_TEXT,
  EMPTY_AFTER_CLEANING,
  ARCHIVE_FAILED
}
