package com.gentoro.graphdb;

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphDatabaseOptionsTest {

  @Test
  @DisplayName("Defaults: undirected, memory-only, pretty-printed atomic writes")
  void defaults() {
    GraphDatabaseOptions options = GraphDatabaseOptions.builder().build();
    assertFalse(options.directed());
    assertNull(options.path());
    assertTrue(options.isMemoryOnly());
    assertTrue(options.prettyPrint());
    assertTrue(options.atomicWrite());
    assertNull(options.storageProvider());
  }

  @Test
  @DisplayName("Blank paths and :memory: both mean memory-only")
  void memoryPaths() {
    assertTrue(GraphDatabaseOptions.builder().path("  ").build().isMemoryOnly());
    assertTrue(GraphDatabaseOptions.builder().path(":memory:").build().isMemoryOnly());
    assertFalse(GraphDatabaseOptions.builder().path("g.json").build().isMemoryOnly());
    assertEquals("g.json", GraphDatabaseOptions.builder().path(" g.json ").build().path());
  }

  @Test
  @DisplayName("Options read graph.* keys from configuration")
  void fromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty(GraphDatabaseOptions.DIRECTED_KEY, "true");
    config.addProperty(GraphDatabaseOptions.PATH_KEY, "/data/g.json");
    config.addProperty(GraphDatabaseOptions.PRETTY_PRINT_KEY, false);
    config.addProperty(GraphDatabaseOptions.PROVIDER_KEY, "file");

    GraphDatabaseOptions options = GraphDatabaseOptions.from(config);
    assertTrue(options.directed());
    assertEquals("/data/g.json", options.path());
    assertFalse(options.prettyPrint());
    assertTrue(options.atomicWrite());
    assertEquals("file", options.storageProvider());

    GraphDatabaseOptions copy = options.toBuilder().directed(false).build();
    assertFalse(copy.directed());
    assertEquals(options.path(), copy.path());
    assertTrue(GraphDatabaseOptions.from(null).isMemoryOnly());
  }
}
