package com.gentoro.graphdb.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, log-friendly description of a failure. */
public record ErrorDetails(
    String type,
    String message,
    GraphDbErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
