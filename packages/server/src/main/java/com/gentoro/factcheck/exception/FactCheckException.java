package com.gentoro.factcheck.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the FactCheck exception hierarchy. Carries a {@link FactCheckErrorCode} that callers
 * branch on and an immutable map of diagnostic details (tool name, file, prompt key).
 */
public class FactCheckException extends RuntimeException {
  private final FactCheckErrorCode code;
  private final Map<String, Object> context;

  public FactCheckException(FactCheckErrorCode code, String message) {
    this(code, message, null, null);
  }

  public FactCheckException(FactCheckErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public FactCheckException(FactCheckErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public FactCheckException(
      FactCheckErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public FactCheckErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append("{code=").append(code).append(", message=").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(", context=").append(context);
    }
    if (getCause() != null) {
      sb.append(", cause=").append(getCause().getClass().getSimpleName());
    }
    return sb.append('}').toString();
  }
}
