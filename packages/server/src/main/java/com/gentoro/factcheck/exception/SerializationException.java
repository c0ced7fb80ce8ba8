package com.gentoro.factcheck.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends FactCheckException {
  public SerializationException(String message) {
    super(FactCheckErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(FactCheckErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
