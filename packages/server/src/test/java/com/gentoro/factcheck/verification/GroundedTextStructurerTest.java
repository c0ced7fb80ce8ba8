package com.gentoro.factcheck.verification;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.factcheck.model.GroundedResult;
import com.gentoro.factcheck.model.GroundingChunk;
import com.gentoro.factcheck.model.GroundingSupport;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GroundedTextStructurerTest {

  private final GroundedTextStructurer structurer = new GroundedTextStructurer();

  private static GroundingSupport support(int start, int end, List<Integer> chunks, Double score) {
    return new GroundingSupport(start, end, chunks, score == null ? List.of() : List.of(score));
  }

  @Test
  @DisplayName("Splices source numbers and the first confidence score after the segment")
  void annotatesSupportedSegment() {
    GroundedResult result =
        new GroundedResult(
            "Claim Analysis: Paris is the capital of France.",
            List.of(support(16, 47, List.of(0), 0.87)),
            List.of(new GroundingChunk("Geo", "https://x")));

    AnnotatedText annotated = structurer.annotate(result);

    assertEquals(
        "Claim Analysis: Paris is the capital of France.[1][0.87]", annotated.processedText());
    assertEquals(List.of("1. [Geo](https://x)"), annotated.citationLines());

    ClaimAnalysis analysis = structurer.structure(result);
    assertEquals("Paris is the capital of France.[1][0.87]", analysis.claimAnalysis());
    assertTrue(analysis.alternatives().isEmpty());
    assertEquals(List.of(new ClaimAnalysis.Citation("Geo", "https://x")), analysis.citations());
  }

  @Test
  void supportsAreAppliedInStartOrder() {
    GroundedResult result =
        new GroundedResult(
            "First. Second.",
            List.of(support(7, 14, List.of(1), 0.5), support(0, 6, List.of(0), 0.9)),
            List.of(new GroundingChunk("A", "https://a"), new GroundingChunk("B", "https://b")));

    assertEquals("First.[1][0.90] Second.[2][0.50]", structurer.annotate(result).processedText());
  }

  @Test
  void omitsScoreWhenAbsentAndListsEveryChunk() {
    GroundedResult result =
        new GroundedResult(
            "First.",
            List.of(support(0, 6, List.of(0, 2), null)),
            List.of(
                new GroundingChunk("A", "https://a"),
                new GroundingChunk("B", "https://b"),
                new GroundingChunk("C", "https://c")));

    AnnotatedText annotated = structurer.annotate(result);
    assertEquals("First.[1,3]", annotated.processedText());
    assertEquals(
        List.of("1. [A](https://a)", "2. [B](https://b)", "3. [C](https://c)"),
        annotated.citationLines());
  }

  @Test
  void offsetsCountCodePoints() {
    GroundedResult result =
        new GroundedResult(
            "😀 ok.",
            List.of(support(2, 5, List.of(0), null)),
            List.of(new GroundingChunk("A", "https://a")));

    assertEquals("😀 ok.[1]", structurer.annotate(result).processedText());
  }

  @Test
  void clampsOutOfRangeOffsets() {
    GroundedResult result =
        new GroundedResult(
            "abc",
            List.of(support(0, 100, List.of(0), null)),
            List.of(new GroundingChunk("A", "https://a")));

    assertEquals("abc[1]", structurer.annotate(result).processedText());
  }

  @Test
  @DisplayName("Confidence ties round half-even on the exact binary value")
  void confidenceTiesRoundHalfEven() {
    GroundedResult result =
        new GroundedResult(
            "abc",
            List.of(support(0, 3, List.of(0), 0.125)),
            List.of(new GroundingChunk("A", "https://a")));

    assertEquals("abc[1][0.12]", structurer.annotate(result).processedText());
    assertEquals("0.38", GroundedTextStructurer.score(0.375));
    // 0.145 is stored just below the tie
    assertEquals("0.14", GroundedTextStructurer.score(0.145));
    assertEquals("1.00", GroundedTextStructurer.score(1.0));
  }

  @Test
  void ungroundedResultGivesEmptyAnalysis() {
    ClaimAnalysis analysis =
        structurer.structure(new GroundedResult("Claim Analysis: unsure.", List.of(), List.of()));

    assertTrue(analysis.isEmpty());
    assertTrue(analysis.toMap().isEmpty());
    assertTrue(structurer.structure(null).isEmpty());
  }

  @Test
  void splitsAnalysisAlternativesAndCitations() {
    GroundedResult result =
        new GroundedResult(
            "Claim Analysis: Partly supported.\n"
                + "Alternatives:\n"
                + "1. Drug X lowers blood pressure in adults. Explanation: Trials enrolled adults"
                + " only.\n"
                + "2. Drug X may lower blood pressure. Explanation: Effect sizes vary.",
            List.of(support(16, 33, List.of(0), 0.75)),
            List.of(new GroundingChunk("Trial", "https://trial")));

    ClaimAnalysis analysis = structurer.structure(result);

    assertEquals("Partly supported.[1][0.75]", analysis.claimAnalysis());
    assertEquals(
        List.of(
            new ClaimAnalysis.Alternative(
                "Drug X lowers blood pressure in adults.", "Trials enrolled adults only."),
            new ClaimAnalysis.Alternative(
                "Drug X may lower blood pressure.", "Effect sizes vary.")),
        analysis.alternatives());
    assertEquals(
        List.of(new ClaimAnalysis.Citation("Trial", "https://trial")), analysis.citations());
  }

  @Test
  void alternativesWithoutExplanationAreSkipped() {
    ClaimAnalysis analysis =
        structurer.parse(
            "Claim Analysis: Fine.\nAlternatives:\n1. No explanation here\n2. Better. Explanation:"
                + " Clearer.");

    assertEquals(
        List.of(new ClaimAnalysis.Alternative("Better.", "Clearer.")), analysis.alternatives());
  }

  @Test
  void structuringIsDeterministic() {
    GroundedResult result =
        new GroundedResult(
            "Claim Analysis: Water boils at 100C at sea level.",
            List.of(support(16, 49, List.of(0), 0.99)),
            List.of(new GroundingChunk("Physics", "https://p")));

    assertEquals(structurer.structure(result), structurer.structure(result));
  }
}
