package com.gentoro.factcheck.exception;

/** Prompt retrieval, parsing or rendering error. */
public class PromptException extends FactCheckException {
  public PromptException(String message) {
    super(FactCheckErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(FactCheckErrorCode.PROMPT_ERROR, message, cause);
  }
}
