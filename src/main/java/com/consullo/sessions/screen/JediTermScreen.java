package com.consullo.sessions.screen;

import com.jediterm.core.util.TermSize;
import com.jediterm.terminal.RequestOrigin;
import com.jediterm.terminal.emulator.JediEmulator;
import com.jediterm.terminal.model.JediTerminal;
import com.jediterm.terminal.model.StyleState;
import com.jediterm.terminal.model.TerminalLine;
import com.jediterm.terminal.model.TerminalTextBuffer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalScreen} backed by JediTerm's emulator and text buffer, without any UI.
 *
 * @since 1.0
 */
public final class JediTermScreen implements TerminalScreen {

  private static final Logger LOGGER = LoggerFactory.getLogger(JediTermScreen.class);

  private final ByteFifoDataStream dataStream = new ByteFifoDataStream();
  private final TitleTrackingDisplay display = new TitleTrackingDisplay();
  private final TerminalTextBuffer textBuffer;
  private final JediTerminal terminal;
  private final JediEmulator emulator;

  private int columns;
  private int rows;

  /**
   * Creates a screen.
   *
   * @param columns screen columns
   * @param rows screen rows
   * @param maxHistoryLines scrollback lines to retain
   */
  public JediTermScreen(int columns, int rows, int maxHistoryLines) {
    Validate.isTrue(columns > 0 && rows > 0, "columns/rows must be positive");
    Validate.isTrue(maxHistoryLines > 0, "maxHistoryLines must be positive");
    this.columns = columns;
    this.rows = rows;

    StyleState styleState = new StyleState();
    this.textBuffer = new TerminalTextBuffer(columns, rows, styleState, maxHistoryLines);
    this.terminal = new JediTerminal(display, textBuffer, styleState);
    this.emulator = new JediEmulator(dataStream, terminal);
  }

  @Override
  public void feed(byte[] data, int offset, int length) {
    Validate.notNull(data, "data must not be null");
    if (length <= 0) {
      return;
    }
    dataStream.append(data, offset, length);

    // The emulator latches EOF once the stream runs dry.
    emulator.resetEof();
    int processed = 0;
    while (emulator.hasNext()) {
      try {
        emulator.next();
        processed++;
      } catch (IOException e) {
        LOGGER.debug("feed: stream ended after {} iterations", processed);
        break;
      } catch (RuntimeException e) {
        LOGGER.warn("feed: emulator failed after {} iterations: {}", processed, e.getMessage());
        break;
      }
    }
  }

  @Override
  public String title() {
    return display.getWindowTitle();
  }

  @Override
  public void resize(int columns, int rows) {
    Validate.isTrue(columns > 0 && rows > 0, "columns/rows must be positive");
    if (columns == this.columns && rows == this.rows) {
      return;
    }
    this.columns = columns;
    this.rows = rows;
    // resizes the text buffer too
    terminal.resize(new TermSize(columns, rows), RequestOrigin.Remote);
  }

  @Override
  public int columns() {
    return columns;
  }

  @Override
  public int rows() {
    return rows;
  }

  @Override
  public List<String> readScreenLines() {
    int height = textBuffer.getHeight();
    List<String> lines = new ArrayList<>(height);
    for (int row = 0; row < height; row++) {
      lines.add(toPlainText(textBuffer.getLine(row)));
    }
    return lines;
  }

  private static String toPlainText(TerminalLine line) {
    if (line == null || line.getEntries() == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (TerminalLine.TextEntry entry : line.getEntries()) {
      if (entry != null && entry.getText() != null) {
        sb.append(entry.getText());
      }
    }
    // Empty cells are NUL
    int end = sb.length();
    while (end > 0) {
      char c = sb.charAt(end - 1);
      if (c == ' ' || c == '\0' || c == '\t') {
        end--;
      } else {
        break;
      }
    }
    sb.setLength(end);
    return sb.toString();
  }
}
