package com.flamingo.ai.tenderlens.service.dedup;

/** Why a file was dropped by the deduplicator. */
public enum DuplicateKind {
  SAME_CONTENT,
  SAME_NAME,
  UNREADABLE
}
