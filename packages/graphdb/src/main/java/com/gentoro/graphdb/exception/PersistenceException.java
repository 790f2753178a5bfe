package com.gentoro.graphdb.exception;

/** The backing file is unreadable, unwritable, or not a graph document of the expected shape. */
public class PersistenceException extends GraphDbException {
  public PersistenceException(String message) {
    super(GraphDbErrorCode.PERSISTENCE_ERROR, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(GraphDbErrorCode.PERSISTENCE_ERROR, message, cause);
  }
}
