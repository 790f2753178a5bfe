package com.gentoro.graphdb.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base type for all failures raised by the graph store.
 *
 * <p>Every instance carries a {@link GraphDbErrorCode} so callers can branch on the kind of
 * failure without inspecting messages, plus an optional context map with the identifiers involved
 * (node id, relationship endpoints, file path, ...).
 */
public class GraphDbException extends RuntimeException {
  private final GraphDbErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public GraphDbException(GraphDbErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public GraphDbException(GraphDbErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public GraphDbErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for chaining at the throw site. */
  public GraphDbException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
