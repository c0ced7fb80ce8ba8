package com.gentoro.factcheck.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A claim extracted by the model. {@code attributes} keeps every field the model supplied
 * (including {@code claim}) so they survive into the processed result.
 */
public record IdentifiedClaim(String claim, Map<String, Object> attributes) {
  public IdentifiedClaim {
    Objects.requireNonNull(claim, "claim");
    attributes = attributes == null ? Map.of("claim", claim) : new LinkedHashMap<>(attributes);
  }
}
