package com.gentoro.graphdb.exception;

/** The node or relationship targeted by a get, update or label operation does not exist. */
public class NotFoundException extends GraphDbException {
  public NotFoundException(String message) {
    super(GraphDbErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(GraphDbErrorCode.NOT_FOUND, message, cause);
  }
}
