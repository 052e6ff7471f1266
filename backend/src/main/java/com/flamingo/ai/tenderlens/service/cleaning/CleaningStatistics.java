package com.flamingo.ai.tenderlens.service.cleaning;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters produced by cleaning, per file or summed over a batch.
 *
 * <p>Mutated additively while cleaning; callers treat it as read-only afterwards. {@link #merge}
 * sums the counters only: lengths describe a single text and are not aggregated.
 */
public class CleaningStatistics {

  private final EnumMap<CleaningCounter, Integer> counters = new EnumMap<>(CleaningCounter.class);
  private int originalLength;
  private int cleanedLength;

  public CleaningStatistics() {
    for (CleaningCounter counter : CleaningCounter.values()) {
      counters.put(counter, 0);
    }
  }

  public void increment(CleaningCounter counter) {
    add(counter, 1);
  }

  public void add(CleaningCounter counter, int amount) {
    counters.merge(counter, amount, Integer::sum);
  }

  public int get(CleaningCounter counter) {
    return counters.get(counter);
  }

  public CleaningStatistics merge(CleaningStatistics other) {
    other.counters.forEach(this::add);
    return this;
  }

  public int getNoiseLinesRemoved() {
    return get(CleaningCounter.NOISE_LINES_REMOVED);
  }

  public int getLongNumbersRemoved() {
    return get(CleaningCounter.LONG_NUMBERS_REMOVED);
  }

  public int getDuplicatesRemoved() {
    return get(CleaningCounter.DUPLICATES_REMOVED);
  }

  public int getKeyHeadersFound() {
    return get(CleaningCounter.KEY_HEADERS_FOUND);
  }

  public int getOriginalLength() {
    return originalLength;
  }

  public void setOriginalLength(int originalLength) {
    this.originalLength = originalLength;
  }

  public int getCleanedLength() {
    return cleanedLength;
  }

  public void setCleanedLength(int cleanedLength) {
    this.cleanedLength = cleanedLength;
  }

  /** Counters and lengths keyed by name, in a stable order. */
  @JsonValue
  public Map<String, Integer> asMap() {
    Map<String, Integer> map = new LinkedHashMap<>();
    counters.forEach((counter, value) -> map.put(counter.key(), value));
    map.put("originalLength", originalLength);
    map.put("cleanedLength", cleanedLength);
    return map;
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}
