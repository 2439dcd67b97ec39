package com.vaultmarket.ledgerserver.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.vaultmarket.infra.storage.StorageException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;

@ExtendWith(MockitoExtension.class)
class FatalStorageFailureHandlerTest {
  @Mock private ConfigurableApplicationContext context;

  @Test
  void shouldCloseContextAndExitWhenSavingFailed() throws Exception {
    CountDownLatch exited = new CountDownLatch(1);
    AtomicInteger exitCode = new AtomicInteger(-1);
    FatalStorageFailureHandler handler =
        new FatalStorageFailureHandler(
            context,
            code -> {
              exitCode.set(code);
              exited.countDown();
            });
    StorageException failure =
        new StorageException(Path.of("ledger.json"), "disk full", new IOException("ENOSPC"));

    handler.onHandlerFailure("transfer", new IllegalStateException("wrapped", failure));

    assertTrue(exited.await(5, TimeUnit.SECONDS));
    assertEquals(1, exitCode.get());
    verify(context).close();
  }

  @Test
  void shouldIgnoreFailuresUnrelatedToStorage() {
    FatalStorageFailureHandler handler =
        new FatalStorageFailureHandler(
            context,
            code -> {
              throw new AssertionError("must not exit");
            });

    handler.onHandlerFailure("login", new IllegalStateException("boom"));

    verifyNoInteractions(context);
  }
}
