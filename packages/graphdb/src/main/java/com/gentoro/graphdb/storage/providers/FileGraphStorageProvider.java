package com.gentoro.graphdb.storage.providers;

import com.gentoro.graphdb.GraphDatabaseOptions;
import com.gentoro.graphdb.exception.ConfigException;
import com.gentoro.graphdb.storage.GraphStorage;
import com.gentoro.graphdb.storage.file.FileGraphStorage;
import com.gentoro.graphdb.storage.spi.GraphStorageProvider;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

public class FileGraphStorageProvider implements GraphStorageProvider {
  @Override
  public String id() {
    return "file";
  }

  @Override
  public boolean supports(GraphDatabaseOptions options) {
    return !options.isMemoryOnly();
  }

  @Override
  public GraphStorage create(GraphDatabaseOptions options) {
    if (options.isMemoryOnly()) {
      throw new ConfigException("File storage needs a path, got '" + options.path() + "'");
    }
    try {
      return new FileGraphStorage(
          Path.of(options.path()), options.prettyPrint(), options.atomicWrite());
    } catch (InvalidPathException e) {
      throw new ConfigException("Invalid graph path '" + options.path() + "'", e);
    }
  }
}
