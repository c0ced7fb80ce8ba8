package com.gentoro.factcheck.verification;

import java.util.List;

/**
 * Grounded text with citation markers spliced in after each supported segment, plus the numbered
 * source list the markers refer to.
 */
public record AnnotatedText(String processedText, List<String> citationLines) {
  static final String CITATIONS_HEADING = "## Citations";

  public AnnotatedText {
    citationLines = List.copyOf(citationLines);
  }

  public String toMarkdown() {
    return processedText + "\n\n" + CITATIONS_HEADING + "\n\n" + String.join("\n", citationLines);
  }
}
