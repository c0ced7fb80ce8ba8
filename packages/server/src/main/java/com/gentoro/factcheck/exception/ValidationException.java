package com.gentoro.factcheck.exception;

/** Input validation failure, including malformed tool-call arguments. */
public class ValidationException extends FactCheckException {
  public ValidationException(String message) {
    super(FactCheckErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(FactCheckErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
