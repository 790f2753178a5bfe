package com.gentoro.graphdb.exception;

/** Stable error codes carried by every {@link GraphDbException}. */
public enum GraphDbErrorCode {
  /** A relationship endpoint does not exist. */
  REFERENCE_ERROR,
  /** The targeted node or relationship does not exist. */
  NOT_FOUND,
  /** Malformed query input, identifier or attribute key. */
  VALIDATION_ERROR,
  /** The backing file could not be read, written or decoded. */
  PERSISTENCE_ERROR,
  /** Configuration could not be loaded. */
  CONFIG_ERROR,
  UNKNOWN
}
