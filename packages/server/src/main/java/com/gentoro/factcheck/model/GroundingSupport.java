package com.gentoro.factcheck.model;

import java.util.List;

/**
 * A span of the grounded answer, in code points, backed by one or more search chunks. Confidence
 * scores run parallel to the chunk indices and may be absent.
 */
public record GroundingSupport(
    int startIndex, int endIndex, List<Integer> chunkIndices, List<Double> confidenceScores) {
  public GroundingSupport {
    chunkIndices = chunkIndices == null ? List.of() : List.copyOf(chunkIndices);
    confidenceScores = confidenceScores == null ? List.of() : List.copyOf(confidenceScores);
  }
}
