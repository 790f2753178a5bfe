package com.gentoro.graphdb.storage;

import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Topology;
import java.util.Optional;

/**
 * Backend that persists the whole graph.
 *
 * <p>Implementations can target different media (a JSON file, nothing at all) without leaking
 * specifics to the database facade. Saves are full rewrites, never diffs.
 */
public interface GraphStorage extends AutoCloseable {

  /**
   * Decode the persisted graph into a fresh store.
   *
   * @return empty when nothing has been persisted yet
   * @throws com.gentoro.graphdb.exception.PersistenceException when persisted data is unreadable
   *     or malformed
   */
  Optional<EntityStore> load(Topology topology);

  /** Persist the complete contents of {@code store}. */
  void save(EntityStore store);

  /** Whether {@link #save} performs any I/O. */
  boolean isPersistent();

  /** Logical backend name. */
  String getStorageName();

  /** Where data is persisted, or null for memory-only storage. */
  String getLocation();

  @Override
  default void close() {}
}
