package com.gentoro.graphdb.storage.spi;

import com.gentoro.graphdb.GraphDatabaseOptions;
import com.gentoro.graphdb.storage.GraphStorage;

/**
 * Service Provider Interface for pluggable {@link GraphStorage} backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.graphdb.storage.spi.GraphStorageProvider
 */
public interface GraphStorageProvider {
  /** Unique provider id usable in configuration, e.g. "file", "in-memory". */
  String id();

  /** Whether this provider handles the location described by {@code options}. */
  boolean supports(GraphDatabaseOptions options);

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable() {
    return true;
  }

  GraphStorage create(GraphDatabaseOptions options);
}
