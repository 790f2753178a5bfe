package com.gentoro.graphdb.exception;

/** A relationship references a node that does not exist. */
public class ReferenceException extends GraphDbException {
  public ReferenceException(String message) {
    super(GraphDbErrorCode.REFERENCE_ERROR, message);
  }

  public ReferenceException(String message, Throwable cause) {
    super(GraphDbErrorCode.REFERENCE_ERROR, message, cause);
  }
}
