package com.vaultmarket.infra.storage;

import java.nio.file.Path;

/** Durable state could not be read or written. Callers treat this as fatal. */
public class StorageException extends RuntimeException {
  private final transient Path path;

  public StorageException(Path path, String message, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
