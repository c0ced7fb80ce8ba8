package com.gentoro.factcheck.verification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured verdict for one claim: the analysis prose, suggested rewordings and the web sources
 * that grounded it. {@link #empty()} stands for "no grounding available".
 */
public record ClaimAnalysis(
    @JsonProperty("claim_analysis") String claimAnalysis,
    @JsonProperty("alternatives") List<Alternative> alternatives,
    @JsonProperty("citations") List<Citation> citations) {

  private static final ClaimAnalysis EMPTY = new ClaimAnalysis(null, List.of(), List.of());

  public ClaimAnalysis {
    alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    citations = citations == null ? List.of() : List.copyOf(citations);
  }

  public static ClaimAnalysis empty() {
    return EMPTY;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return claimAnalysis == null;
  }

  /** Plain-map view merged into tool payloads and chat documents; empty when ungrounded. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (isEmpty()) return map;
    map.put("claim_analysis", claimAnalysis);
    map.put(
        "alternatives",
        alternatives.stream().map(Alternative::toMap).collect(Collectors.toList()));
    map.put("citations", citations.stream().map(Citation::toMap).collect(Collectors.toList()));
    return map;
  }

  public record Alternative(
      @JsonProperty("improved_claim") String improvedClaim,
      @JsonProperty("explanation") String explanation) {
    Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("improved_claim", improvedClaim);
      map.put("explanation", explanation);
      return map;
    }
  }

  public record Citation(
      @JsonProperty("title") String title, @JsonProperty("uri") String uri) {
    Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("title", title);
      map.put("uri", uri);
      return map;
    }
  }
}
