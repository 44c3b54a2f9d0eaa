package com.gentoro.jsonflow.exception;

/**
 * Wraps an unexpected failure that escaped the batch loop. Per-item transform failures never
 * surface as this exception; they are recorded in the item's result instead.
 */
public class ProcessingException extends JsonFlowException {
  public ProcessingException(String message, Throwable cause) {
    super(JsonFlowErrorCode.PROCESSING_ERROR, message, cause);
  }
}
