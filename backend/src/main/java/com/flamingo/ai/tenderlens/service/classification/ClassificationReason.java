package com.flamingo.ai.tenderlens.service.classification;

/** Why the filename classifier kept or discarded a file. */
public enum ClassificationReason {
  INCLUDE_MARKER,
  EXCLUDE_MARKER,
  NEUTRAL_SHORT_NAME,
  UNINFORMATIVE_NAME,
  DISALLOWED_EXTENSION
}
