package com.gentoro.factcheck.exception;

import java.util.Map;

/**
 * A tool handler failed (bad arguments, downstream verification failure). Recovered locally by
 * the dispatcher, which turns it into an error-shaped tool response so the round continues.
 */
public class ToolExecutionException extends FactCheckException {
  public ToolExecutionException(String toolName, String message, Throwable cause) {
    super(FactCheckErrorCode.TOOL_EXECUTION_ERROR, message, Map.of("tool", toolName), cause);
  }

  public String toolName() {
    return String.valueOf(getContext().get("tool"));
  }
}
