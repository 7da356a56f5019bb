package com.consullo.sessions.window;

import com.consullo.sessions.screen.TerminalScreen;
import org.apache.commons.lang3.Validate;

/**
 * Logical window hosting a terminal screen.
 *
 * <p>
 * The sessions bound to a window are tracked by the session registry and its
 * workspace membership by the workspace manager; the window itself holds
 * neither.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalWindow {

  private final long id;
  private final TerminalScreen screen;

  private String customTitle;

  TerminalWindow(long id, TerminalScreen screen) {
    this.id = id;
    this.screen = screen;
  }

  public long id() {
    return id;
  }

  public TerminalScreen screen() {
    return screen;
  }

  /**
   * Returns the title the operator assigned, or null if none.
   *
   * @return operator-assigned title or null
   */
  public String customTitle() {
    return customTitle;
  }

  /**
   * Sets or clears (with null) the operator-assigned title.
   *
   * @param customTitle title or null
   */
  public void setCustomTitle(String customTitle) {
    Validate.isTrue(customTitle == null || !customTitle.isBlank(), "customTitle must not be blank");
    this.customTitle = customTitle;
  }

  /**
   * Returns the operator title if set, else the title requested by the process.
   *
   * @return current title, possibly empty
   */
  public String currentTitle() {
    return customTitle != null ? customTitle : screen.title();
  }

  @Override
  public String toString() {
    return "TerminalWindow#" + id;
  }
}
