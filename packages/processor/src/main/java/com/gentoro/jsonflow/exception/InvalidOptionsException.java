package com.gentoro.jsonflow.exception;

/** Raised when processing options are rejected, always before any batch runs. */
public class InvalidOptionsException extends JsonFlowException {
  public InvalidOptionsException(String message) {
    super(JsonFlowErrorCode.INVALID_OPTIONS, message);
  }
}
