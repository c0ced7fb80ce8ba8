package com.gentoro.factcheck.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-instance configuration of a model client: which model, the system instruction, the declared
 * tools with their calling mode, and generation options.
 */
public record ModelSettings(
    String modelName,
    String systemInstruction,
    List<ToolDefinition> tools,
    ToolCallingMode toolCallingMode,
    float temperature,
    int maxOutputTokens) {

  public ModelSettings {
    Objects.requireNonNull(modelName, "modelName");
    tools = tools == null ? List.of() : List.copyOf(tools);
    toolCallingMode = toolCallingMode == null ? ToolCallingMode.none() : toolCallingMode;
    if (tools.isEmpty() && toolCallingMode.kind() != ToolCallingMode.Kind.NONE) {
      toolCallingMode = ToolCallingMode.none();
    }
  }

  public static ModelSettings of(
      String modelName, String systemInstruction, float temperature, int maxOutputTokens) {
    return new ModelSettings(
        modelName,
        systemInstruction,
        List.of(),
        ToolCallingMode.none(),
        temperature,
        maxOutputTokens);
  }

  public ModelSettings withTools(List<ToolDefinition> tools, ToolCallingMode mode) {
    return new ModelSettings(
        modelName, systemInstruction, tools, mode, temperature, maxOutputTokens);
  }

  public ModelSettings withoutTools() {
    return new ModelSettings(
        modelName,
        systemInstruction,
        List.of(),
        ToolCallingMode.none(),
        temperature,
        maxOutputTokens);
  }

  public ModelSettings withTemperature(float temperature) {
    return new ModelSettings(
        modelName, systemInstruction, tools, toolCallingMode, temperature, maxOutputTokens);
  }
}
