package com.consullo.sessions.window;

import java.util.IdentityHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * {@link WindowLayout} without a screen. Every window reports the same
 * available width and is granted exactly what it asks for; placement,
 * visibility and focus are remembered so callers can inspect them.
 *
 * @since 1.0
 */
public final class HeadlessWindowLayout implements WindowLayout {

  private final double availableWidth;
  private final Map<TerminalWindow, TabPlacement> placements = new IdentityHashMap<>();
  private final Map<TerminalWindow, Boolean> visibility = new IdentityHashMap<>();
  private TerminalWindow focused;

  /**
   * @param availableWidth width every window reports as available
   */
  public HeadlessWindowLayout(double availableWidth) {
    Validate.isTrue(availableWidth > 0, "availableWidth must be positive");
    this.availableWidth = availableWidth;
  }

  @Override
  public double maxAvailableTabWidth(TerminalWindow window) {
    return availableWidth;
  }

  @Override
  public double grantTabWidth(TerminalWindow window, double offset, double width) {
    placements.put(window, new TabPlacement(offset, width));
    return width;
  }

  @Override
  public void setVisible(TerminalWindow window, boolean visible) {
    visibility.put(window, visible);
    if (!visible) {
      placements.remove(window);
      if (focused == window) {
        focused = null;
      }
    }
  }

  @Override
  public void focus(TerminalWindow window) {
    focused = window;
  }

  public TabPlacement placementOf(TerminalWindow window) {
    return placements.get(window);
  }

  public boolean isVisible(TerminalWindow window) {
    return visibility.getOrDefault(window, false);
  }

  /**
   * @return the last focused window, or null
   */
  public TerminalWindow focusedWindow() {
    return focused;
  }
}
