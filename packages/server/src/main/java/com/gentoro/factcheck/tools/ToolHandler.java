package com.gentoro.factcheck.tools;

/** Executes one decoded tool call. Failures are thrown and turned into error responses upstream. */
@FunctionalInterface
public interface ToolHandler<T extends ToolCall> {
  ToolResponse handle(T call, ToolInvocationContext context);
}
