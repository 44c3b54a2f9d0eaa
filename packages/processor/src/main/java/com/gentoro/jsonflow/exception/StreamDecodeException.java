package com.gentoro.jsonflow.exception;

/** Input stream was empty, unreadable, or did not contain a single well-formed JSON document. */
public class StreamDecodeException extends JsonFlowException {
  public StreamDecodeException(String message) {
    super(JsonFlowErrorCode.DECODE_ERROR, message);
  }

  public StreamDecodeException(String message, Throwable cause) {
    super(JsonFlowErrorCode.DECODE_ERROR, message, cause);
  }
}
