package com.consullo.sessions.window;

import com.consullo.sessions.CoordinatorEvent;
import com.consullo.sessions.InvalidHandleException;
import com.consullo.sessions.ThreadConfinement;
import com.consullo.sessions.hub.NotificationHub;
import com.consullo.sessions.screen.TerminalScreen;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creation-ordered collection of terminal windows.
 *
 * <p>
 * Untracking a window also runs the untrack hook given at construction (the
 * workspace manager uses it to drop the window from its workspace) and hides
 * the window. A window that still hosts sessions cannot be untracked; its
 * sessions are disposed first. Mutations fail off the coordinating thread.
 * </p>
 *
 * @since 1.0
 */
public final class WindowRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(WindowRegistry.class);

  private final NotificationHub<CoordinatorEvent> hub;
  private final WindowLayout layout;
  private final ThreadConfinement confinement;
  private final Consumer<TerminalWindow> untrackHook;
  private final Predicate<TerminalWindow> hostsSessions;

  private final List<TerminalWindow> windowsInCreationOrder = new ArrayList<>();
  private long nextWindowId = 1;

  /**
   * @param hub notification hub
   * @param layout window layout collaborator
   * @param confinement coordinating-thread guard
   * @param untrackHook run for each untracked window, before it is hidden
   * @param hostsSessions tells whether sessions are still bound to a window
   */
  public WindowRegistry(
          NotificationHub<CoordinatorEvent> hub,
          WindowLayout layout,
          ThreadConfinement confinement,
          Consumer<TerminalWindow> untrackHook,
          Predicate<TerminalWindow> hostsSessions) {
    Validate.notNull(hub, "hub must not be null");
    Validate.notNull(layout, "layout must not be null");
    Validate.notNull(confinement, "confinement must not be null");
    Validate.notNull(untrackHook, "untrackHook must not be null");
    Validate.notNull(hostsSessions, "hostsSessions must not be null");
    this.hub = hub;
    this.layout = layout;
    this.confinement = confinement;
    this.untrackHook = untrackHook;
    this.hostsSessions = hostsSessions;
  }

  /**
   * Creates an untracked window hosting the given screen.
   *
   * @param screen output sink for the window
   * @return new window
   */
  public TerminalWindow newWindow(TerminalScreen screen) {
    confinement.check();
    Validate.notNull(screen, "screen must not be null");
    return new TerminalWindow(nextWindowId++, screen);
  }

  public void track(TerminalWindow window) {
    confinement.check();
    Validate.notNull(window, "window must not be null");
    Validate.isTrue(!isTracked(window), "window %s is already tracked", window.id());
    windowsInCreationOrder.add(window);
    LOGGER.debug("Tracking {}", window);
    hub.publish(CoordinatorEvent.WINDOW_LIST_CHANGED, window);
  }

  /**
   * Stops tracking a window, removes it from its workspace and hides it.
   *
   * @param window tracked window without sessions
   * @throws InvalidHandleException if the window is not tracked
   * @throws IllegalStateException if sessions are still bound to the window
   */
  public void untrack(TerminalWindow window) {
    confinement.check();
    Validate.notNull(window, "window must not be null");
    if (!windowsInCreationOrder.contains(window)) {
      throw new InvalidHandleException("Window " + window.id() + " is not tracked");
    }
    Validate.validState(!hostsSessions.test(window), "window %s still hosts sessions", window.id());
    windowsInCreationOrder.remove(window);
    untrackHook.accept(window);
    layout.setVisible(window, false);
    LOGGER.debug("Untracked {}", window);
    hub.publish(CoordinatorEvent.WINDOW_LIST_CHANGED, window);
  }

  public boolean isTracked(TerminalWindow window) {
    return window != null && windowsInCreationOrder.contains(window);
  }

  public int count() {
    return windowsInCreationOrder.size();
  }

  public List<TerminalWindow> windows() {
    return List.copyOf(windowsInCreationOrder);
  }

  /**
   * Visits every tracked window in creation order. The callback must not track or untrack windows.
   *
   * @param callback visitor
   */
  public void forEach(Consumer<TerminalWindow> callback) {
    confinement.check();
    Validate.notNull(callback, "callback must not be null");
    windowsInCreationOrder.forEach(callback);
  }

  /**
   * Visits a copy of the window list, so the callback may untrack windows.
   *
   * @param callback visitor
   */
  public void forEachSnapshot(Consumer<TerminalWindow> callback) {
    confinement.check();
    Validate.notNull(callback, "callback must not be null");
    new ArrayList<>(windowsInCreationOrder).forEach(callback);
  }

  /**
   * Forgets every window. Used at shutdown.
   */
  public void clear() {
    confinement.check();
    windowsInCreationOrder.clear();
  }
}
