package com.consullo.sessions.window;

/**
 * Window content layout and presentation, provided by the host UI.
 *
 * <p>All calls happen on the coordinating thread.
 *
 * @since 1.0
 */
public interface WindowLayout {

  /**
   * Returns the widest tab the window could show, in logical units.
   *
   * @param window window
   * @return maximum available tab width
   */
  double maxAvailableTabWidth(TerminalWindow window);

  /**
   * Asks for a tab at the given position. The layout may clamp the width.
   *
   * @param window window
   * @param offset tab offset
   * @param width requested width
   * @return width actually granted
   */
  double grantTabWidth(TerminalWindow window, double offset, double width);

  void setVisible(TerminalWindow window, boolean visible);

  void focus(TerminalWindow window);
}
