package com.consullo.sessions.spawn;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PtyProcessController} implemented with pty4j.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();

  /**
   * Spawns a PTY-attached process and starts watching for its exit.
   *
   * @param config process configuration
   * @throws IOException if the process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.isTrue(config.initialColumns() > 0, "initialColumns must be positive");
    Validate.isTrue(config.initialRows() > 0, "initialRows must be positive");

    final PtyProcessBuilder builder = new PtyProcessBuilder(config.command().toArray(new String[0]))
            .setDirectory(config.workingDirectory().toString())
            .setEnvironment(config.environment())
            .setInitialColumns(config.initialColumns())
            .setInitialRows(config.initialRows());
    this.process = builder.start();
    LOGGER.debug("Started {} as PID {}", config.command(), process.pid());

    final Thread monitor = new Thread(() -> {
      try {
        this.exitFuture.complete(this.process.waitFor());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyExitMonitor-" + process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }

  @Override
  public InputStream getPtyOutput() {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getPtyInput() {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws IOException {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    try {
      this.process.setWinSize(new WinSize(columns, rows));
    } catch (final IllegalStateException e) {
      throw new IOException("PTY resize failed: " + e.getMessage(), e);
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public long pid() {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void close() {
    if (this.process.isAlive()) {
      this.process.destroy();
    }
  }
}
