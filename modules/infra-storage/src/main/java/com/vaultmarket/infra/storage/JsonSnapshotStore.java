package com.vaultmarket.infra.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Whole-state persistence: every save rewrites the snapshot file. The new content is written to a
 * sibling temp file first and moved over the old one, so a crash leaves either the old or the new
 * snapshot on disk.
 */
public class JsonSnapshotStore<T> {
  private static final Logger log = LoggerFactory.getLogger(JsonSnapshotStore.class);

  private final Path file;
  private final Class<T> type;
  private final ObjectMapper objectMapper;

  public JsonSnapshotStore(Path file, Class<T> type) {
    this(file, type, defaultObjectMapper());
  }

  public JsonSnapshotStore(Path file, Class<T> type, ObjectMapper objectMapper) {
    this.file = Objects.requireNonNull(file, "file must not be null");
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public static ObjectMapper defaultObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    return mapper;
  }

  /** The stored snapshot, or empty when none has been saved yet. */
  public Optional<T> load() {
    if (!Files.exists(file)) {
      log.info("No snapshot at {}, starting empty", file);
      return Optional.empty();
    }
    try {
      String json = Files.readString(file, StandardCharsets.UTF_8);
      return Optional.of(objectMapper.readValue(json, type));
    } catch (JsonProcessingException ex) {
      throw new StorageException(file, "Snapshot is not readable", ex);
    } catch (IOException ex) {
      throw new StorageException(file, "Failed to read snapshot", ex);
    }
  }

  public void save(T snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(temp, objectMapper.writeValueAsString(snapshot), StandardCharsets.UTF_8);
      moveIntoPlace(temp);
    } catch (IOException ex) {
      throw new StorageException(file, "Failed to write snapshot", ex);
    }
  }

  public Path file() {
    return file;
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}, replacing in place", file);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
