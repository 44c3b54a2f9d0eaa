package com.gentoro.jsonflow.exception;

/** Errors raised when a component is used in the wrong lifecycle state. */
public class StateException extends JsonFlowException {
  public StateException(String message) {
    super(JsonFlowErrorCode.STATE_ERROR, message);
  }
}
