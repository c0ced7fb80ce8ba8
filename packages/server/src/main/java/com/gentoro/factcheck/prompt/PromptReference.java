package com.gentoro.factcheck.prompt;

import java.util.Map;
import java.util.Objects;

/** Pointer from a configuration key to the prompt file holding its text. */
public record PromptReference(String fileName, Map<String, Object> attributes) {
  public PromptReference {
    Objects.requireNonNull(fileName, "fileName");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static PromptReference of(String fileName) {
    return new PromptReference(fileName, Map.of());
  }
}
