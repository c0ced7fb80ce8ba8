package com.gentoro.factcheck.utility;

public class StringUtility {

  /** Collapses every run of whitespace (including line breaks) into a single space. */
  public static String collapseWhitespace(String input) {
    if (input == null) return null;
    return input.replaceAll("\\s+", " ");
  }

  /** Shortened, single-line rendition of a text for log lines. */
  public static String preview(String input, int limit) {
    if (input == null) return "";
    String flat = input.replaceAll("\\r\\n?|\\n", " ").trim();
    if (limit < 0 || flat.length() <= limit) return flat;
    return flat.substring(0, limit) + "…";
  }
}
