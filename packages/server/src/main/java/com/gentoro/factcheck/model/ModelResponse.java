package com.gentoro.factcheck.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one model call: the ordered content parts of the reply and the conversation history
 * updated with both the request message and the reply.
 */
public record ModelResponse(List<Part> parts, List<Turn> history) {
  public ModelResponse {
    parts = List.copyOf(parts);
    history = List.copyOf(history);
  }

  public List<Part.FunctionCall> functionCalls() {
    return parts.stream()
        .filter(Part.FunctionCall.class::isInstance)
        .map(Part.FunctionCall.class::cast)
        .collect(Collectors.toList());
  }
}
