package com.gentoro.graphdb.exception;

/**
 * Malformed caller input, such as an unknown operator or direction token, an invalid identifier or
 * a reserved attribute key.
 */
public class ValidationException extends GraphDbException {
  public ValidationException(String message) {
    super(GraphDbErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GraphDbErrorCode.VALIDATION_ERROR, message, cause);
  }
}
