package com.gentoro.factcheck.verification;

import com.gentoro.factcheck.model.GroundedResult;
import com.gentoro.factcheck.model.GroundingChunk;
import com.gentoro.factcheck.model.GroundingSupport;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a grounded verification answer into a {@link ClaimAnalysis}.
 *
 * <p>First, every grounding support is rendered inline: the supported segment is followed by the
 * 1-based numbers of its sources and, when present, the first confidence score, e.g. {@code Paris
 * is the capital of France.[1][0.87]}. A numbered markdown list of sources is appended under a
 * citations heading. The annotated markdown is then split into the analysis prose (before {@code
 * Alternatives:}), the numbered alternatives (each carrying an {@code Explanation:}) and the
 * citation links.
 *
 * <p>Segment offsets are code-point positions in the answer text. Out-of-range offsets are clamped
 * to the text.
 */
public class GroundedTextStructurer {
  private static final String CLAIM_ANALYSIS_LABEL = "Claim Analysis:";
  private static final String ALTERNATIVES_DELIMITER = "\nAlternatives:";
  private static final String EXPLANATION_LABEL = "Explanation:";
  private static final Pattern ALTERNATIVE_SPLIT = Pattern.compile("\\n\\d+\\.");
  private static final Pattern CITATION_LINK = Pattern.compile("\\d+\\.\\s+\\[(.*?)\\]\\((.*?)\\)");
  private static final Pattern CITATIONS_SECTION =
      Pattern.compile(Pattern.quote(AnnotatedText.CITATIONS_HEADING) + ".*", Pattern.DOTALL);

  /** Annotate and parse; returns {@link ClaimAnalysis#empty()} for ungrounded results. */
  public ClaimAnalysis structure(GroundedResult result) {
    if (result == null || !result.hasGrounding()) {
      return ClaimAnalysis.empty();
    }
    return parse(annotate(result).toMarkdown());
  }

  public AnnotatedText annotate(GroundedResult result) {
    int[] codePoints = result.text().codePoints().toArray();
    List<GroundingSupport> supports = new ArrayList<>(result.supports());
    supports.sort(Comparator.comparingInt(GroundingSupport::startIndex));

    StringBuilder processed = new StringBuilder();
    int lastEnd = 0;
    for (GroundingSupport support : supports) {
      processed.append(slice(codePoints, lastEnd, support.startIndex()));
      processed.append(slice(codePoints, support.startIndex(), support.endIndex()));
      processed.append(
          support.chunkIndices().stream()
              .map(i -> String.valueOf(i + 1))
              .collect(Collectors.joining(",", "[", "]")));
      if (!support.confidenceScores().isEmpty()) {
        processed.append('[').append(score(support.confidenceScores().get(0))).append(']');
      }
      lastEnd = support.endIndex();
    }
    processed.append(slice(codePoints, lastEnd, codePoints.length));

    List<String> citations = new ArrayList<>();
    List<GroundingChunk> chunks = result.chunks();
    for (int i = 0; i < chunks.size(); i++) {
      GroundingChunk chunk = chunks.get(i);
      citations.add((i + 1) + ". [" + chunk.title() + "](" + chunk.uri() + ")");
    }
    return new AnnotatedText(processed.toString(), citations);
  }

  /** Parse annotated markdown into its analysis, alternatives and citations. */
  public ClaimAnalysis parse(String markdown) {
    String[] sections = markdown.split(ALTERNATIVES_DELIMITER, 2);
    String claimAnalysis = sections[0].replace(CLAIM_ANALYSIS_LABEL, "").strip();
    claimAnalysis = CITATIONS_SECTION.matcher(claimAnalysis).replaceAll("").strip();

    List<ClaimAnalysis.Alternative> alternatives = new ArrayList<>();
    if (sections.length > 1) {
      String alternativesText = CITATIONS_SECTION.matcher(sections[1]).replaceAll("");
      for (String chunk : ALTERNATIVE_SPLIT.split(alternativesText, -1)) {
        int at = chunk.indexOf(EXPLANATION_LABEL);
        if (at < 0) continue;
        alternatives.add(
            new ClaimAnalysis.Alternative(
                chunk.substring(0, at).strip(),
                chunk.substring(at + EXPLANATION_LABEL.length()).strip()));
      }
    }

    List<ClaimAnalysis.Citation> citations = new ArrayList<>();
    Matcher m = CITATION_LINK.matcher(markdown);
    while (m.find()) {
      citations.add(new ClaimAnalysis.Citation(m.group(1), m.group(2)));
    }
    return new ClaimAnalysis(claimAnalysis, alternatives, citations);
  }

  /** Two decimals, rounding the exact binary value half-even. */
  static String score(double value) {
    return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
  }

  private static String slice(int[] codePoints, int from, int to) {
    int start = clamp(from, codePoints.length);
    int end = clamp(to, codePoints.length);
    if (end <= start) return "";
    return new String(codePoints, start, end - start);
  }

  private static int clamp(int index, int length) {
    return Math.max(0, Math.min(index, length));
  }
}
