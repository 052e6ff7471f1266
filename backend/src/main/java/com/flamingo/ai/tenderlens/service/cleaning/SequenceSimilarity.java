package com.flamingo.ai.tenderlens.service.cleaning;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity between two strings.
 *
 * <p>Repeatedly takes the longest common block (leftmost in {@code a}, then leftmost in {@code b})
 * and recurses on both sides of it. The ratio is {@code 2 * matched / (len(a) + len(b))}; two empty
 * strings are identical. No junk heuristics are applied.
 *
 * <p>Block search only visits positions of {@code b} holding the current character of {@code a}.
 * {@link #exceeds} checks cheap upper bounds before computing the full ratio.
 */
public final class SequenceSimilarity {

  private SequenceSimilarity() {}

  public static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, b) / total;
  }

  /** Same as {@code ratio(a, b) > threshold}, rejecting clearly different strings early. */
  public static boolean exceeds(String a, String b, double threshold) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0 > threshold;
    }
    if (2.0 * Math.min(a.length(), b.length()) / total <= threshold) {
      return false;
    }
    if (2.0 * commonCharacters(a, b) / total <= threshold) {
      return false;
    }
    return ratio(a, b) > threshold;
  }

  /** Size of the multiset intersection of the characters of both strings. */
  static int commonCharacters(String a, String b) {
    Map<Character, Integer> available = new HashMap<>();
    for (int j = 0; j < b.length(); j++) {
      available.merge(b.charAt(j), 1, Integer::sum);
    }
    int common = 0;
    for (int i = 0; i < a.length(); i++) {
      Integer left = available.get(a.charAt(i));
      if (left != null && left > 0) {
        available.put(a.charAt(i), left - 1);
        common++;
      }
    }
    return common;
  }

  static int matchingCharacters(String a, String b) {
    BlockFinder finder = new BlockFinder(a, b);
    int matched = 0;
    Deque<int[]> ranges = new ArrayDeque<>();
    ranges.push(new int[] {0, a.length(), 0, b.length()});
    while (!ranges.isEmpty()) {
      int[] r = ranges.pop();
      int[] block = finder.longestMatch(r[0], r[1], r[2], r[3]);
      int size = block[2];
      if (size == 0) {
        continue;
      }
      matched += size;
      int i = block[0];
      int j = block[1];
      if (r[0] < i && r[2] < j) {
        ranges.push(new int[] {r[0], i, r[2], j});
      }
      if (i + size < r[1] && j + size < r[3]) {
        ranges.push(new int[] {i + size, r[1], j + size, r[3]});
      }
    }
    return matched;
  }

  /**
   * Longest-block search over one pair of strings. Run lengths are kept per position of {@code b}
   * and only the touched entries are reset between rows.
   */
  private static final class BlockFinder {

    private final String a;
    private final Map<Character, int[]> positions;
    private int[] previous;
    private int[] current;
    private int[] previousTouched;
    private int[] currentTouched;

    BlockFinder(String a, String b) {
      this.a = a;
      this.positions = indexPositions(b);
      this.previous = new int[b.length() + 1];
      this.current = new int[b.length() + 1];
      this.previousTouched = new int[b.length()];
      this.currentTouched = new int[b.length()];
    }

    /** Returns {@code {i, j, size}} of the longest block a[i..i+size) == b[j..j+size). */
    int[] longestMatch(int alo, int ahi, int blo, int bhi) {
      int bestI = alo;
      int bestJ = blo;
      int bestSize = 0;
      int previousCount = 0;
      for (int i = alo; i < ahi; i++) {
        int currentCount = 0;
        int[] hits = positions.get(a.charAt(i));
        if (hits != null) {
          for (int j : hits) {
            if (j < blo) {
              continue;
            }
            if (j >= bhi) {
              break;
            }
            // previous[j] is the run ending at (i - 1, j - 1)
            int size = previous[j] + 1;
            current[j + 1] = size;
            currentTouched[currentCount++] = j + 1;
            if (size > bestSize) {
              bestI = i - size + 1;
              bestJ = j - size + 1;
              bestSize = size;
            }
          }
        }
        clear(previous, previousTouched, previousCount);
        int[] swap = previous;
        previous = current;
        current = swap;
        swap = previousTouched;
        previousTouched = currentTouched;
        currentTouched = swap;
        previousCount = currentCount;
      }
      clear(previous, previousTouched, previousCount);
      return new int[] {bestI, bestJ, bestSize};
    }

    private static void clear(int[] lengths, int[] touched, int count) {
      for (int t = 0; t < count; t++) {
        lengths[touched[t]] = 0;
      }
    }

    private static Map<Character, int[]> indexPositions(String b) {
      Map<Character, Integer> counts = new HashMap<>();
      for (int j = 0; j < b.length(); j++) {
        counts.merge(b.charAt(j), 1, Integer::sum);
      }
      Map<Character, int[]> index = new HashMap<>();
      Map<Character, Integer> filled = new HashMap<>();
      for (int j = 0; j < b.length(); j++) {
        char c = b.charAt(j);
        int[] slots = index.computeIfAbsent(c, key -> new int[counts.get(key)]);
        int at = filled.merge(c, 1, Integer::sum) - 1;
        slots[at] = j;
      }
      return index;
    }
  }
}
