package com.consullo.sessions;

import com.consullo.sessions.marshal.MarshalledRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dedicated coordinating thread.
 *
 * <p>
 * The thread builds and initializes a {@link SessionCoordinator}, then
 * alternates between running submitted tasks and applying marshalled
 * requests. {@link #close()} stops the loop and shuts the coordinator down on
 * its own thread.
 * </p>
 *
 * @since 1.0
 */
public final class CoordinatorEventLoop implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinatorEventLoop.class);

  private static final long POLL_MILLIS = 20L;
  private static final long JOIN_MILLIS = 5_000L;

  /**
   * Work to run on the coordinating thread.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface Task<T> {
    T run(SessionCoordinator coordinator) throws Exception;
  }

  private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
  private final CompletableFuture<SessionCoordinator> ready = new CompletableFuture<>();
  private final Thread thread;
  private volatile boolean running = true;

  private CoordinatorEventLoop(Supplier<SessionCoordinator> coordinatorFactory) {
    this.thread = new Thread(() -> run(coordinatorFactory), "SessionCoordinator");
    this.thread.setDaemon(true);
  }

  /**
   * Starts the loop.
   *
   * @param coordinatorFactory builds the coordinator; called on the new thread
   * @return running loop
   */
  public static CoordinatorEventLoop start(Supplier<SessionCoordinator> coordinatorFactory) {
    Validate.notNull(coordinatorFactory, "coordinatorFactory must not be null");
    CoordinatorEventLoop loop = new CoordinatorEventLoop(coordinatorFactory);
    loop.thread.start();
    return loop;
  }

  /**
   * Runs a task on the coordinating thread.
   *
   * @param task task
   * @param <T> result type
   * @return future completed with the task's result or exception
   */
  public <T> CompletableFuture<T> submit(Task<T> task) {
    Validate.notNull(task, "task must not be null");
    CompletableFuture<T> result = new CompletableFuture<>();
    if (!running) {
      result.completeExceptionally(new IllegalStateException("event loop is closed"));
      return result;
    }
    tasks.add(() -> {
      try {
        result.complete(task.run(ready.join()));
      } catch (Exception e) {
        result.completeExceptionally(e);
      }
    });
    if (!thread.isAlive() && ready.isDone()) {
      // the loop ended between the check above and the add
      rejectRemainingTasks();
    }
    return result;
  }

  /**
   * Queues a marshalled request. Safe from any thread and never blocks.
   *
   * @param request request
   * @return false if the request was dropped because the coordinator is not
   *         running yet, failed to start or is shut down
   */
  public boolean post(MarshalledRequest request) {
    Validate.notNull(request, "request must not be null");
    if (!ready.isDone() || ready.isCompletedExceptionally()) {
      LOGGER.debug("Dropping {}: coordinator not running", request);
      return false;
    }
    return ready.join().post(request);
  }

  /**
   * @return future completed with the coordinator once it is initialized
   */
  public CompletableFuture<SessionCoordinator> coordinator() {
    return ready;
  }

  public boolean isRunning() {
    return running && thread.isAlive();
  }

  /**
   * Stops the loop, shuts the coordinator down and waits for the thread to end.
   */
  @Override
  public void close() {
    running = false;
    try {
      thread.join(JOIN_MILLIS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      LOGGER.warn("Coordinator thread did not stop within {} ms", JOIN_MILLIS);
    }
  }

  private void run(Supplier<SessionCoordinator> coordinatorFactory) {
    SessionCoordinator coordinator;
    try {
      coordinator = coordinatorFactory.get();
      coordinator.init();
    } catch (RuntimeException e) {
      LOGGER.warn("Coordinator failed to start: {}", e.getMessage(), e);
      running = false;
      ready.completeExceptionally(e);
      return;
    }
    ready.complete(coordinator);

    try {
      while (running) {
        runTasks();
        coordinator.processRequests(POLL_MILLIS, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
    } finally {
      runTasks();
      coordinator.shutdown();
      rejectRemainingTasks();
    }
  }

  private void runTasks() {
    Runnable task;
    while ((task = tasks.poll()) != null) {
      task.run();
    }
  }

  private void rejectRemainingTasks() {
    List<Runnable> leftover = new ArrayList<>();
    tasks.drainTo(leftover);
    // Tasks complete their futures themselves; running them after shutdown
    // makes each fail with the coordinator's shut-down error.
    leftover.forEach(Runnable::run);
  }
}
