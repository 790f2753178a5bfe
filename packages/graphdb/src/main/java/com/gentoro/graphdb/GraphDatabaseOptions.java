package com.gentoro.graphdb;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Construction-time settings of a {@link GraphDatabase}.
 *
 * <p>A null or blank path, or {@value #MEMORY_PATH}, selects memory-only operation.
 */
public final class GraphDatabaseOptions {
  public static final String MEMORY_PATH = ":memory:";

  public static final String DIRECTED_KEY = "graph.directed";
  public static final String PATH_KEY = "graph.path";
  public static final String PRETTY_PRINT_KEY = "graph.storage.pretty-print";
  public static final String ATOMIC_WRITE_KEY = "graph.storage.atomic-write";
  public static final String PROVIDER_KEY = "graph.storage.provider";

  private final boolean directed;
  private final String path;
  private final boolean prettyPrint;
  private final boolean atomicWrite;
  private final String storageProvider;

  private GraphDatabaseOptions(Builder b) {
    this.directed = b.directed;
    this.path = StringUtils.isBlank(b.path) ? null : b.path.trim();
    this.prettyPrint = b.prettyPrint;
    this.atomicWrite = b.atomicWrite;
    this.storageProvider = StringUtils.trimToNull(b.storageProvider);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static GraphDatabaseOptions inMemory(boolean directed) {
    return builder().directed(directed).build();
  }

  /** Options read from {@code graph.*} keys; absent keys keep their defaults. */
  public static GraphDatabaseOptions from(Configuration configuration) {
    Builder b = builder();
    if (configuration == null) return b.build();
    return b.directed(configuration.getBoolean(DIRECTED_KEY, false))
        .path(configuration.getString(PATH_KEY, null))
        .prettyPrint(configuration.getBoolean(PRETTY_PRINT_KEY, true))
        .atomicWrite(configuration.getBoolean(ATOMIC_WRITE_KEY, true))
        .storageProvider(configuration.getString(PROVIDER_KEY, null))
        .build();
  }

  public boolean directed() {
    return directed;
  }

  /** Configured path, or null when none was given. */
  public String path() {
    return path;
  }

  public boolean isMemoryOnly() {
    return path == null || MEMORY_PATH.equals(path);
  }

  public boolean prettyPrint() {
    return prettyPrint;
  }

  public boolean atomicWrite() {
    return atomicWrite;
  }

  /** Explicit storage provider id, or null to pick one from the path. */
  public String storageProvider() {
    return storageProvider;
  }

  public Builder toBuilder() {
    return builder()
        .directed(directed)
        .path(path)
        .prettyPrint(prettyPrint)
        .atomicWrite(atomicWrite)
        .storageProvider(storageProvider);
  }

  @Override
  public String toString() {
    return "GraphDatabaseOptions{directed="
        + directed
        + ", path="
        + (isMemoryOnly() ? MEMORY_PATH : path)
        + ", prettyPrint="
        + prettyPrint
        + ", atomicWrite="
        + atomicWrite
        + (storageProvider != null ? ", storageProvider=" + storageProvider : "")
        + "}";
  }

  public static final class Builder {
    private boolean directed;
    private String path;
    private boolean prettyPrint = true;
    private boolean atomicWrite = true;
    private String storageProvider;

    private Builder() {}

    public Builder directed(boolean directed) {
      this.directed = directed;
      return this;
    }

    public Builder path(String path) {
      this.path = path;
      return this;
    }

    public Builder prettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public Builder atomicWrite(boolean atomicWrite) {
      this.atomicWrite = atomicWrite;
      return this;
    }

    public Builder storageProvider(String storageProvider) {
      this.storageProvider = storageProvider;
      return this;
    }

    public GraphDatabaseOptions build() {
      return new GraphDatabaseOptions(this);
    }
  }
}
