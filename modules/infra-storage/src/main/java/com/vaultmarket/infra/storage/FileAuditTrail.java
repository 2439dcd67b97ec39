package com.vaultmarket.infra.storage;

import com.vaultmarket.domain.common.AuditRecord;
import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.common.InMemoryAuditTrail;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Audit trail appended line by line to a file, with the most recent lines also kept in memory for
 * the admin console. Existing lines are replayed into the tail on start.
 */
public class FileAuditTrail implements AuditTrail {
  private final Path file;
  private final Clock clock;
  private final InMemoryAuditTrail tail;

  public FileAuditTrail(Path file, int tailCapacity, Clock clock) {
    this.file = Objects.requireNonNull(file, "file must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.tail = new InMemoryAuditTrail(tailCapacity, clock);
    replayExisting();
  }

  @Override
  public synchronized AuditRecord append(String message) {
    AuditRecord record =
        new AuditRecord(clock.instant(), Objects.requireNonNull(message, "message"));
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(
          file,
          record.toLine() + System.lineSeparator(),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException ex) {
      throw new StorageException(file, "Failed to append audit record", ex);
    }
    tail.remember(record);
    return record;
  }

  @Override
  public List<AuditRecord> tail(int limit) {
    return tail.tail(limit);
  }

  public Path file() {
    return file;
  }

  private void replayExisting() {
    if (!Files.exists(file)) {
      return;
    }
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) {
          tail.remember(parse(line));
        }
      }
    } catch (IOException ex) {
      throw new StorageException(file, "Failed to read audit trail", ex);
    }
  }

  static AuditRecord parse(String line) {
    int close = line.indexOf("] ");
    if (line.startsWith("[") && close > 1) {
      try {
        Instant at = Instant.parse(line.substring(1, close));
        return new AuditRecord(at, line.substring(close + 2));
      } catch (DateTimeParseException ex) {
        return new AuditRecord(Instant.EPOCH, line);
      }
    }
    return new AuditRecord(Instant.EPOCH, line);
  }
}
