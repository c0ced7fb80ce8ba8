package com.gentoro.factcheck.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends FactCheckException {
  public StateException(String message) {
    super(FactCheckErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(FactCheckErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
