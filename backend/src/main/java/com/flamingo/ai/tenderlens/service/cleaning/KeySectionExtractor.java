package com.flamingo.ai.tenderlens.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Splits structured text on its {@code **Header**} lines. */
@Component
public class KeySectionExtractor {

  /**
   * Returns header to body in document order. Lines before the first header and headers without a
   * body are left out; blank lines are dropped and the remaining lines are trimmed.
   */
  public Map<String, String> extract(String cleanText) {
    Map<String, String> sections = new LinkedHashMap<>();
    if (cleanText == null || cleanText.isBlank()) {
      return sections;
    }
    String current = null;
    List<String> body = new ArrayList<>();
    for (String raw : cleanText.split("\n")) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (isHeader(line)) {
        store(sections, current, body);
        current = stripStars(line);
        body = new ArrayList<>();
      } else if (current != null) {
        body.add(line);
      }
    }
    store(sections, current, body);
    return sections;
  }

  private static boolean isHeader(String line) {
    return line.length() > 4 && line.startsWith("**") && line.endsWith("**");
  }

  private static String stripStars(String line) {
    int start = 0;
    int end = line.length();
    while (start < end && line.charAt(start) == '*') {
      start++;
    }
    while (end > start && line.charAt(end - 1) == '*') {
      end--;
    }
    return line.substring(start, end);
  }

  private static void store(Map<String, String> sections, String header, List<String> body) {
    if (header != null && !body.isEmpty()) {
      sections.put(header, String.join("\n", body).strip());
    }
  }
}
