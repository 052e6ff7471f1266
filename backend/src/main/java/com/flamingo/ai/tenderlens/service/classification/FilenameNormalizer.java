package com.flamingo.ai.tenderlens.service.classification;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of a filename used both for classification and as the secondary dedup key.
 *
 * <p>Strips the extension, turns {@code _} and {@code -} into spaces, squeezes whitespace and
 * lower-cases the result.
 */
public final class FilenameNormalizer {

  private static final Pattern EXTENSION =
      Pattern.compile("\\.\\w+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private FilenameNormalizer() {}

  public static String normalize(String filename) {
    if (filename == null) {
      return "";
    }
    String name = EXTENSION.matcher(filename).replaceFirst("");
    name = name.replace('_', ' ').replace('-', ' ');
    name = WHITESPACE.matcher(name).replaceAll(" ");
    return name.strip().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the lower-cased extension without the dot, or an empty string when there is none.
   * Leading-dot names such as {@code .hidden} have no extension.
   */
  public static String extension(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot <= 0 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
