package com.gentoro.factcheck.exception;

import java.util.Map;

/** The model emitted a function call whose name has no registered handler. */
public class UnresolvedFunctionException extends FactCheckException {
  public UnresolvedFunctionException(String functionName) {
    super(
        FactCheckErrorCode.UNRESOLVED_FUNCTION,
        "No handler registered for function `" + functionName + "`",
        Map.of("function", String.valueOf(functionName)));
  }

  public String functionName() {
    return String.valueOf(getContext().get("function"));
  }
}
