package com.gentoro.factcheck.prompt;

import java.util.Map;

/** A prompt text with named placeholders. */
public interface PromptTemplate {
  /** Identifier of this template (usually the configuration key it came from). */
  String id();

  String render(Map<String, Object> variables);
}
