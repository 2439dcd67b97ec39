package com.vaultmarket.infra.rpc.dispatch;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs every inbound request of a process, RPC or admin, one at a time in arrival order. State
 * owned by the process is only touched from the dispatch thread.
 */
public class ProcessDispatcher implements AutoCloseable {
  private final ExecutorService executor;
  private volatile Thread dispatchThread;

  public ProcessDispatcher(String name) {
    Objects.requireNonNull(name, "name must not be null");
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, name + "-dispatch");
              thread.setDaemon(true);
              dispatchThread = thread;
              return thread;
            });
  }

  public void execute(Runnable task) {
    executor.execute(Objects.requireNonNull(task, "task must not be null"));
  }

  /** Runs {@code task} on the dispatch thread and waits for it; runs inline when already there. */
  public <T> T call(Callable<T> task) {
    Objects.requireNonNull(task, "task must not be null");
    if (isDispatchThread()) {
      return invokeInline(task);
    }
    try {
      return executor.submit(task).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for dispatch", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Dispatched task failed", cause);
    }
  }

  public void run(Runnable task) {
    call(
        () -> {
          task.run();
          return null;
        });
  }

  public boolean isDispatchThread() {
    return Thread.currentThread() == dispatchThread;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static <T> T invokeInline(Callable<T> task) {
    try {
      return task.call();
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new IllegalStateException("Dispatched task failed", ex);
    }
  }
}
