package com.gentoro.factcheck.tools;

import java.util.List;
import java.util.Map;

/** Decoded, typed arguments of a model-emitted function call. */
public sealed interface ToolCall permits ToolCall.ClaimsIdentification, ToolCall.ImpreciseLanguage {

  ToolKind kind();

  record ClaimsIdentification(List<IdentifiedClaim> claims) implements ToolCall {
    public ClaimsIdentification {
      claims = List.copyOf(claims);
    }

    @Override
    public ToolKind kind() {
      return ToolKind.MEDICAL_CLAIMS_IDENTIFICATION;
    }
  }

  /** Instances are free-form records; only their shape as objects is enforced. */
  record ImpreciseLanguage(List<Map<String, Object>> instances) implements ToolCall {
    public ImpreciseLanguage {
      instances = List.copyOf(instances);
    }

    @Override
    public ToolKind kind() {
      return ToolKind.IMPRECISE_LANGUAGE_IDENTIFICATION;
    }
  }
}
