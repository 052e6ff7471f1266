package com.flamingo.ai.tenderlens.service.cleaning;

/** Named counters accumulated while cleaning text. */
public enum CleaningCounter {
  NOISE_LINES_REMOVED("noiseLinesRemoved"),
  LONG_NUMBERS_REMOVED("longNumbersRemoved"),
  DUPLICATES_REMOVED("duplicatesRemoved"),
  KEY_HEADERS_FOUND("keyHeadersFound");

  private final String key;

  CleaningCounter(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
