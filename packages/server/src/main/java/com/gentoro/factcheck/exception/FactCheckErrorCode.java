package com.gentoro.factcheck.exception;

/**
 * Canonical error codes for FactCheck. Codes are stable and suitable for downstream services,
 * persisted progress documents and logs. Prefer the most specific code that reflects the failure
 * origin and actionability.
 */
public enum FactCheckErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PROMPT_ERROR,
  LLM_ERROR,
  TOOL_EXECUTION_ERROR,
  UNRESOLVED_FUNCTION,
}
