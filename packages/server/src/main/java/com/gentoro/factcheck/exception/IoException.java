package com.gentoro.factcheck.exception;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends FactCheckException {
  public IoException(String message) {
    super(FactCheckErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(FactCheckErrorCode.IO_ERROR, message, cause);
  }
}
