package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.model.Part;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Result of one tool call, sent back to the model as a function-response part. */
public record ToolResponse(String name, Map<String, Object> payload, String nextStepInstruction) {
  static final String NEXT_STEPS_FIELD = "next_steps_instruction";

  public ToolResponse {
    Objects.requireNonNull(name, "name");
    payload = payload == null ? Map.of() : new LinkedHashMap<>(payload);
  }

  public static ToolResponse error(ToolKind kind, String message) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("error", message);
    payload.put("instructions", kind.retryInstruction());
    return new ToolResponse(kind.functionName(), payload, null);
  }

  public boolean isError() {
    return payload.containsKey("error");
  }

  public Part toPart() {
    Map<String, Object> response = new LinkedHashMap<>(payload);
    if (nextStepInstruction != null) {
      response.put(NEXT_STEPS_FIELD, nextStepInstruction);
    }
    return new Part.FunctionResponse(name, response);
  }
}
