package com.consullo.sessions.screen;

import java.util.List;

/**
 * Output sink a terminal window hosts: converts raw process bytes into screen
 * state and remembers the title the process last asked for.
 *
 * <p>Implementations are fed from the coordinating thread only.
 *
 * @since 1.0
 */
public interface TerminalScreen {

  /**
   * Feeds raw bytes produced by the process.
   *
   * @param data raw bytes
   * @param offset offset into the data array
   * @param length number of bytes to consume
   */
  void feed(final byte[] data, final int offset, final int length);

  /**
   * Returns the title set by the process through an OSC sequence, or an empty string.
   *
   * @return window title requested by the process
   */
  String title();

  /**
   * Resizes the screen.
   *
   * @param columns number of columns
   * @param rows number of rows
   */
  void resize(final int columns, final int rows);

  int columns();

  int rows();

  /**
   * Returns the visible rows as plain text, right-trimmed.
   *
   * @return screen lines, top to bottom
   */
  List<String> readScreenLines();
}
