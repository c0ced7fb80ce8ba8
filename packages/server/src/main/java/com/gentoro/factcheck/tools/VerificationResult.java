package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.verification.ClaimAnalysis;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A verified claim: the model-supplied claim fields, the analysis and a stable identifier. */
public record VerificationResult(String id, IdentifiedClaim claim, ClaimAnalysis analysis) {
  public VerificationResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(claim, "claim");
    analysis = analysis == null ? ClaimAnalysis.empty() : analysis;
  }

  public String claimText() {
    return claim.claim();
  }

  /** Flat view: claim fields, then analysis fields, then {@code id}. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>(claim.attributes());
    map.putAll(analysis.toMap());
    map.put("id", id);
    return map;
  }
}
