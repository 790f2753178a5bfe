package com.gentoro.graphdb.storage.providers;

import com.gentoro.graphdb.GraphDatabaseOptions;
import com.gentoro.graphdb.storage.GraphStorage;
import com.gentoro.graphdb.storage.memory.InMemoryGraphStorage;
import com.gentoro.graphdb.storage.spi.GraphStorageProvider;

public class InMemoryGraphStorageProvider implements GraphStorageProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public boolean supports(GraphDatabaseOptions options) {
    return options.isMemoryOnly();
  }

  @Override
  public GraphStorage create(GraphDatabaseOptions options) {
    return new InMemoryGraphStorage();
  }
}
