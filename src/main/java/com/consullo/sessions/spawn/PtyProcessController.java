package com.consullo.sessions.spawn;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * A running PTY-attached process.
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  /**
   * @return stream of bytes the process writes to its terminal
   */
  InputStream getPtyOutput();

  /**
   * @return stream feeding the process's terminal input
   */
  OutputStream getPtyInput();

  void resize(final int columns, final int rows) throws IOException;

  /**
   * @return future completed with the exit code when the process terminates
   */
  CompletableFuture<Integer> onExit();

  long pid();

  boolean isAlive();

  /**
   * Destroys the process.
   */
  @Override
  void close();
}
