package com.gentoro.graphdb.storage.memory;

import com.gentoro.graphdb.storage.GraphStorage;
import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Topology;
import java.util.Optional;

/** Memory-only storage: nothing is loaded and saves perform no I/O. */
public class InMemoryGraphStorage implements GraphStorage {

  @Override
  public Optional<EntityStore> load(Topology topology) {
    return Optional.empty();
  }

  @Override
  public void save(EntityStore store) {}

  @Override
  public boolean isPersistent() {
    return false;
  }

  @Override
  public String getStorageName() {
    return "in-memory";
  }

  @Override
  public String getLocation() {
    return null;
  }
}
