package com.gentoro.graphdb.storage.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.gentoro.graphdb.exception.PersistenceException;
import com.gentoro.graphdb.storage.GraphCodec;
import com.gentoro.graphdb.storage.GraphStorage;
import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Topology;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * Stores the graph as one JSON document on disk.
 *
 * <p>Every save rewrites the whole file. With atomic writes enabled the document is written to a
 * temporary sibling and moved over the target, so a crash mid-write leaves the previous file
 * intact; file systems without atomic moves fall back to a plain replace.
 */
public class FileGraphStorage implements GraphStorage {
  private static final Logger log =
      com.gentoro.graphdb.logging.LoggingService.getLogger(FileGraphStorage.class);

  private final Path path;
  private final boolean prettyPrint;
  private final boolean atomicWrite;

  public FileGraphStorage(Path path, boolean prettyPrint, boolean atomicWrite) {
    this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
    this.prettyPrint = prettyPrint;
    this.atomicWrite = atomicWrite;
  }

  public Path path() {
    return path;
  }

  @Override
  public Optional<EntityStore> load(Topology topology) {
    if (!Files.exists(path)) {
      log.info("Graph file {} does not exist yet, starting empty", path);
      return Optional.empty();
    }
    if (Files.isDirectory(path)) {
      throw failure("Graph path is a directory: " + path, null);
    }
    JsonNode document;
    try (InputStream in = Files.newInputStream(path)) {
      document = JacksonUtility.getJsonMapper().readTree(in);
    } catch (JsonProcessingException e) {
      throw failure("Graph file " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw failure("Could not read graph file " + path, e);
    }
    if (document == null || document.isMissingNode()) {
      throw failure("Graph file " + path + " is empty", null);
    }
    EntityStore store;
    try {
      store = GraphCodec.decode(document, topology);
    } catch (PersistenceException e) {
      e.withContext("path", path.toString());
      throw e;
    }
    log.info(
        "Loaded {} node(s) and {} relationship(s) from {}",
        store.nodeCount(),
        store.relationshipCount(),
        path);
    return Optional.of(store);
  }

  @Override
  public void save(EntityStore store) {
    ObjectWriter writer =
        prettyPrint
            ? JacksonUtility.getJsonMapper().writerWithDefaultPrettyPrinter()
            : JacksonUtility.getJsonMapper().writer();
    JsonNode document = GraphCodec.encode(store);
    try {
      Path parent = path.getParent();
      if (parent != null) Files.createDirectories(parent);
      if (atomicWrite) {
        writeAtomically(writer, document, parent);
      } else {
        try (OutputStream out = Files.newOutputStream(path)) {
          writer.writeValue(out, document);
        }
      }
    } catch (IOException e) {
      throw failure("Could not write graph file " + path, e);
    }
    log.debug(
        "Saved {} node(s) and {} relationship(s) to {}",
        store.nodeCount(),
        store.relationshipCount(),
        path);
  }

  private void writeAtomically(ObjectWriter writer, JsonNode document, Path dir)
      throws IOException {
    // createFile honors the umask, unlike createTempFile which is owner-only
    Path tmp = Files.createFile(
        dir.resolve(path.getFileName() + "." + UUID.randomUUID() + ".tmp"));
    try {
      try (OutputStream out = Files.newOutputStream(tmp)) {
        writer.writeValue(out, document);
      }
      copyPermissions(tmp);
      try {
        Files.move(
            tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, replacing in place", path);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  /** Keeps the mode of the file being replaced; no-op for new files or non-POSIX stores. */
  private void copyPermissions(Path tmp) throws IOException {
    if (!Files.exists(path)) return;
    if (Files.getFileAttributeView(path, PosixFileAttributeView.class) == null) return;
    Files.setPosixFilePermissions(tmp, Files.getPosixFilePermissions(path));
  }

  private PersistenceException failure(String message, Throwable cause) {
    PersistenceException e =
        cause == null
            ? new PersistenceException(message)
            : new PersistenceException(message, cause);
    e.withContext("path", path.toString());
    return e;
  }

  @Override
  public boolean isPersistent() {
    return true;
  }

  @Override
  public String getStorageName() {
    return "file";
  }

  @Override
  public String getLocation() {
    return path.toString();
  }
}
