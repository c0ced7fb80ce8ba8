package com.gentoro.factcheck.exception;

/** Configuration or prompt reference missing or invalid, detected at startup or runtime. */
public class ConfigException extends FactCheckException {
  public ConfigException(String message) {
    super(FactCheckErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FactCheckErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
