package com.vaultmarket.ledgerserver.config;

import com.vaultmarket.infra.rpc.server.RpcHandlerFailureListener;
import com.vaultmarket.infra.storage.StorageException;
import java.util.Objects;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Stops the process when state can no longer be persisted. Serving on after a failed save would
 * acknowledge changes that a restart silently forgets.
 */
public class FatalStorageFailureHandler implements RpcHandlerFailureListener {
  private static final Logger log = LoggerFactory.getLogger(FatalStorageFailureHandler.class);

  private final ConfigurableApplicationContext context;
  private final IntConsumer exit;

  public FatalStorageFailureHandler(ConfigurableApplicationContext context) {
    this(context, System::exit);
  }

  public FatalStorageFailureHandler(ConfigurableApplicationContext context, IntConsumer exit) {
    this.context = Objects.requireNonNull(context, "context must not be null");
    this.exit = Objects.requireNonNull(exit, "exit must not be null");
  }

  @Override
  public void onHandlerFailure(String operation, RuntimeException error) {
    StorageException storageFailure = storageFailure(error);
    if (storageFailure != null) {
      halt(storageFailure);
    }
  }

  /** Closes the context and exits from a separate thread so the dispatcher can drain. */
  public void halt(StorageException failure) {
    log.error("Persisting state failed at {}, shutting down", failure.path(), failure);
    Thread shutdown =
        new Thread(
            () -> {
              int code = SpringApplication.exit(context, () -> 1);
              exit.accept(code);
            },
            "fatal-storage-shutdown");
    shutdown.start();
  }

  static StorageException storageFailure(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof StorageException storage) {
        return storage;
      }
      current = current.getCause();
    }
    return null;
  }
}
