package com.gentoro.graphdb.exception;

/** Configuration could not be read or holds an unusable value. */
public class ConfigException extends GraphDbException {
  public ConfigException(String message) {
    super(GraphDbErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GraphDbErrorCode.CONFIG_ERROR, message, cause);
  }
}
