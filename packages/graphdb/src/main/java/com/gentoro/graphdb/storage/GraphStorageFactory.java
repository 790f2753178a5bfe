package com.gentoro.graphdb.storage;

import com.gentoro.graphdb.GraphDatabaseOptions;
import com.gentoro.graphdb.exception.ConfigException;
import com.gentoro.graphdb.storage.spi.GraphStorageProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.slf4j.Logger;

/**
 * Picks the {@link GraphStorageProvider} for a set of options.
 *
 * <p>An explicit {@link GraphDatabaseOptions#storageProvider()} id wins; otherwise the first
 * available provider that supports the configured path is used.
 */
public final class GraphStorageFactory {
  private static final Logger log =
      com.gentoro.graphdb.logging.LoggingService.getLogger(GraphStorageFactory.class);

  private GraphStorageFactory() {}

  public static GraphStorage create(GraphDatabaseOptions options) {
    String requested = options.storageProvider();
    for (GraphStorageProvider provider : providers()) {
      if (!provider.isAvailable()) continue;
      boolean selected =
          requested != null ? requested.equals(provider.id()) : provider.supports(options);
      if (selected) {
        log.debug("Using graph storage provider '{}' for {}", provider.id(), options.path());
        return provider.create(options);
      }
    }
    throw new ConfigException(
            requested != null
                ? "Unknown graph storage provider '" + requested + "', available: " + providerIds()
                : "No graph storage provider supports location '" + options.path() + "'")
        .withContext("provider", requested);
  }

  public static List<String> providerIds() {
    List<String> ids = new ArrayList<>();
    for (GraphStorageProvider provider : providers()) ids.add(provider.id());
    return ids;
  }

  private static ServiceLoader<GraphStorageProvider> providers() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = GraphStorageFactory.class.getClassLoader();
    return ServiceLoader.load(GraphStorageProvider.class, cl);
  }
}
