package com.consullo.sessions.workspace;

import com.consullo.sessions.window.TerminalWindow;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered group of windows shown as a tab stack. The order is the tab order.
 *
 * @since 1.0
 */
public final class Workspace {

  private final long id;
  private final long creationRank;
  private final List<TerminalWindow> windows = new ArrayList<>();

  Workspace(long id, long creationRank) {
    this.id = id;
    this.creationRank = creationRank;
  }

  public long id() {
    return id;
  }

  /**
   * Larger ranks were created later.
   *
   * @return creation rank
   */
  public long creationRank() {
    return creationRank;
  }

  public List<TerminalWindow> windows() {
    return List.copyOf(windows);
  }

  public int size() {
    return windows.size();
  }

  public boolean isEmpty() {
    return windows.isEmpty();
  }

  List<TerminalWindow> members() {
    return windows;
  }

  @Override
  public String toString() {
    return "Workspace#" + id + windows;
  }
}
