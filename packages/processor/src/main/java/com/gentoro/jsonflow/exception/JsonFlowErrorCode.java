package com.gentoro.jsonflow.exception;

/** Stable error codes attached to every {@link JsonFlowException}. */
public enum JsonFlowErrorCode {
  /** Configuration could not be loaded or is malformed. */
  CONFIGURATION_ERROR,
  /** Processing options failed validation. */
  INVALID_OPTIONS,
  /** Input stream could not be read or decoded into a JSON tree. */
  DECODE_ERROR,
  /** Component used in a state that does not allow the call. */
  STATE_ERROR,
  /** Unexpected failure while a job was running. */
  PROCESSING_ERROR,
  UNKNOWN
}
