package com.gentoro.factcheck.model;

import java.util.Objects;

/**
 * Restricts which declared tools a model may call on a turn.
 *
 * <ul>
 *   <li>{@link Kind#AUTO}: the model chooses freely between text and any declared tool.
 *   <li>{@link Kind#FORCED}: the model must call exactly the named tool.
 *   <li>{@link Kind#NONE}: no tools are offered.
 * </ul>
 */
public record ToolCallingMode(Kind kind, String allowedFunctionName) {
  public enum Kind {
    AUTO,
    FORCED,
    NONE
  }

  public ToolCallingMode {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.FORCED && (allowedFunctionName == null || allowedFunctionName.isBlank())) {
      throw new IllegalArgumentException("Forced tool calling requires a function name");
    }
  }

  public static ToolCallingMode auto() {
    return new ToolCallingMode(Kind.AUTO, null);
  }

  public static ToolCallingMode forced(String functionName) {
    return new ToolCallingMode(Kind.FORCED, functionName);
  }

  public static ToolCallingMode none() {
    return new ToolCallingMode(Kind.NONE, null);
  }
}
