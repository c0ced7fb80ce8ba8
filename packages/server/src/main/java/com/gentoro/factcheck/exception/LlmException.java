package com.gentoro.factcheck.exception;

/** Errors raised while calling a generative model or interpreting its responses. */
public class LlmException extends FactCheckException {
  public LlmException(String message) {
    super(FactCheckErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(FactCheckErrorCode.LLM_ERROR, message, cause);
  }
}
