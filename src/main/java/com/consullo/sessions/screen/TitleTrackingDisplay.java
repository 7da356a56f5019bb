package com.consullo.sessions.screen;

import com.jediterm.core.Color;
import com.jediterm.core.util.TermSize;
import com.jediterm.terminal.CursorShape;
import com.jediterm.terminal.RequestOrigin;
import com.jediterm.terminal.TerminalDisplay;
import com.jediterm.terminal.emulator.mouse.MouseFormat;
import com.jediterm.terminal.emulator.mouse.MouseMode;
import com.jediterm.terminal.model.TerminalSelection;

/**
 * Display without pixels. Drawing calls are ignored; the only state kept is the
 * window title the emulator reports.
 */
final class TitleTrackingDisplay implements TerminalDisplay {

  private String windowTitle = "";

  @Override
  public void setCursor(int x, int y) {
  }

  @Override
  public void setCursorShape(CursorShape cursorShape) {
  }

  @Override
  public void beep() {
  }

  @Override
  public void onResize(TermSize termSize, RequestOrigin origin) {
  }

  @Override
  public void scrollArea(int scrollRegionTop, int scrollRegionSize, int dy) {
  }

  @Override
  public void setCursorVisible(boolean visible) {
  }

  @Override
  public void useAlternateScreenBuffer(boolean enabled) {
  }

  @Override
  public String getWindowTitle() {
    return windowTitle;
  }

  @Override
  public void setWindowTitle(String title) {
    this.windowTitle = title != null ? title : "";
  }

  @Override
  public TerminalSelection getSelection() {
    return null;
  }

  @Override
  public void terminalMouseModeSet(MouseMode mode) {
  }

  @Override
  public void setMouseFormat(MouseFormat format) {
  }

  @Override
  public boolean ambiguousCharsAreDoubleWidth() {
    return false;
  }

  @Override
  public void setBracketedPasteMode(boolean enabled) {
  }

  @Override
  public Color getWindowForeground() {
    return null;
  }

  @Override
  public Color getWindowBackground() {
    return null;
  }
}
