package com.consullo.sessions.workspace;

import com.consullo.sessions.CoordinatorEvent;
import com.consullo.sessions.InvalidHandleException;
import com.consullo.sessions.ThreadConfinement;
import com.consullo.sessions.hub.NotificationHub;
import com.consullo.sessions.window.TabPlacement;
import com.consullo.sessions.window.TerminalWindow;
import com.consullo.sessions.window.WindowLayout;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups windows into workspaces and packs their tabs.
 *
 * <p>
 * A window belongs to at most one workspace; the membership is kept here as a
 * lookup, the window has no reference to its workspace. A workspace left empty
 * by a removal is discarded.
 * </p>
 *
 * <p>
 * Tab packing: with {@code n} windows, the ideal width is
 * {@code min(smallestMaxAvailable / n, averageWidth)}. Tabs are granted left to
 * right; each offset advances by the width the layout actually granted, not the
 * ideal, so clamped windows do not make later tabs drift. Measurements below
 * the minimum width are clamped up to it.
 * </p>
 *
 * <p>
 * Only windows tracked by the window registry can join a workspace. Every
 * mutation fails off the coordinating thread.
 * </p>
 *
 * @since 1.0
 */
public final class WorkspaceManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceManager.class);

  private final NotificationHub<CoordinatorEvent> hub;
  private final WindowLayout layout;
  private final TabLayoutConfig tabConfig;
  private final ThreadConfinement confinement;
  private final Supplier<TerminalWindow> focusedWindow;
  private final Predicate<TerminalWindow> trackedWindow;

  private final Map<Long, Workspace> workspaces = new LinkedHashMap<>();
  private final Map<TerminalWindow, Workspace> workspaceByWindow = new IdentityHashMap<>();

  private long nextWorkspaceId = 1;
  private long nextRank = 1;
  private boolean autoRearrange;

  /**
   * @param hub notification hub
   * @param layout window layout collaborator
   * @param tabConfig tab packing constants
   * @param confinement coordinating-thread guard
   * @param focusedWindow supplies the window of the session the user is focused on (may return null)
   * @param trackedWindow tells whether the window registry tracks a window
   * @param autoRearrange whether tabs are packed after every membership change
   */
  public WorkspaceManager(
          NotificationHub<CoordinatorEvent> hub,
          WindowLayout layout,
          TabLayoutConfig tabConfig,
          ThreadConfinement confinement,
          Supplier<TerminalWindow> focusedWindow,
          Predicate<TerminalWindow> trackedWindow,
          boolean autoRearrange) {
    Validate.notNull(hub, "hub must not be null");
    Validate.notNull(layout, "layout must not be null");
    Validate.notNull(tabConfig, "tabConfig must not be null");
    Validate.notNull(confinement, "confinement must not be null");
    Validate.notNull(focusedWindow, "focusedWindow must not be null");
    Validate.notNull(trackedWindow, "trackedWindow must not be null");
    this.hub = hub;
    this.layout = layout;
    this.tabConfig = tabConfig;
    this.confinement = confinement;
    this.focusedWindow = focusedWindow;
    this.trackedWindow = trackedWindow;
    this.autoRearrange = autoRearrange;
  }

  public Workspace createWorkspace() {
    confinement.check();
    Workspace workspace = new Workspace(nextWorkspaceId++, nextRank++);
    workspaces.put(workspace.id(), workspace);
    LOGGER.info("Created {}", workspace);
    return workspace;
  }

  /**
   * Appends a window to a workspace, first removing it from any workspace it is in.
   *
   * @param workspace target workspace
   * @param window tracked window
   * @throws InvalidHandleException if the workspace or the window is unknown
   */
  public void addWindow(Workspace workspace, TerminalWindow window) {
    confinement.check();
    requireKnown(workspace);
    requireTracked(window);
    if (workspaceByWindow.get(window) == workspace) {
      return;
    }
    removeWindow(window);

    workspace.members().add(window);
    workspaceByWindow.put(window, workspace);
    hub.publish(CoordinatorEvent.WORKSPACE_MEMBERSHIP_CHANGED, workspace);
    if (autoRearrange) {
      rearrangeTabs(workspace);
    }
  }

  /**
   * Removes a window from whichever workspaces hold it. Does nothing if none do.
   *
   * @param window window
   */
  public void removeWindow(TerminalWindow window) {
    confinement.check();
    Validate.notNull(window, "window must not be null");
    workspaceByWindow.remove(window);
    for (Workspace workspace : new ArrayList<>(workspaces.values())) {
      if (!workspace.members().remove(window)) {
        continue;
      }
      if (workspace.isEmpty()) {
        workspaces.remove(workspace.id());
        LOGGER.debug("Discarded empty {}", workspace);
      } else if (autoRearrange) {
        rearrangeTabs(workspace);
      }
      hub.publish(CoordinatorEvent.WORKSPACE_MEMBERSHIP_CHANGED, workspace);
    }
  }

  /**
   * Moves a window into a workspace of its own.
   *
   * @param window tracked window
   * @return the new workspace
   * @throws InvalidHandleException if the window is not tracked
   */
  public Workspace moveToNewWorkspace(TerminalWindow window) {
    confinement.check();
    requireTracked(window);
    Workspace vacated = workspaceByWindow.get(window);
    removeWindow(window);

    Workspace fresh = createWorkspace();
    fresh.members().add(window);
    workspaceByWindow.put(window, fresh);
    hub.publish(CoordinatorEvent.WORKSPACE_MEMBERSHIP_CHANGED, fresh);

    if (vacated != null && workspaces.containsKey(vacated.id())) {
      rearrangeTabs(vacated);
    }
    rearrangeTabs(fresh);
    return fresh;
  }

  /**
   * Picks the workspace new windows should join: the one holding the focused
   * session's window, else the most recently created one, else a new one.
   *
   * @return active workspace
   */
  public Workspace activeWorkspace() {
    confinement.check();
    TerminalWindow focused = focusedWindow.get();
    if (focused != null) {
      Workspace holding = workspaceByWindow.get(focused);
      if (holding != null) {
        return holding;
      }
    }
    Workspace newest = null;
    for (Workspace workspace : workspaces.values()) {
      if (newest == null || workspace.creationRank() > newest.creationRank()) {
        newest = workspace;
      }
    }
    return newest != null ? newest : createWorkspace();
  }

  /**
   * Packs the tabs of a workspace.
   *
   * @param workspace workspace
   * @return placements granted, in tab order (empty for an empty workspace)
   */
  public List<TabPlacement> rearrangeTabs(Workspace workspace) {
    confinement.check();
    requireKnown(workspace);
    List<TerminalWindow> members = workspace.members();
    int n = members.size();
    if (n == 0) {
      return List.of();
    }

    double smallestMax = Double.MAX_VALUE;
    for (TerminalWindow window : members) {
      smallestMax = Math.min(smallestMax, clampToMinimum(window, layout.maxAvailableTabWidth(window)));
    }
    double idealWidth = Math.max(Math.min(smallestMax / n, tabConfig.averageWidth()), tabConfig.minimumWidth());

    List<TabPlacement> placements = new ArrayList<>(n);
    double offset = 0;
    for (TerminalWindow window : members) {
      double granted = clampToMinimum(window, layout.grantTabWidth(window, offset, idealWidth));
      placements.add(new TabPlacement(offset, granted));
      LOGGER.debug("{} tab at {} width {}", window, offset, granted);
      offset += granted;
    }
    return Collections.unmodifiableList(placements);
  }

  /**
   * Turns automatic packing on or off. Turning it on packs every workspace once.
   *
   * @param enabled new value
   */
  public void setAutoRearrange(boolean enabled) {
    confinement.check();
    boolean wasEnabled = autoRearrange;
    autoRearrange = enabled;
    if (enabled && !wasEnabled) {
      for (Workspace workspace : new ArrayList<>(workspaces.values())) {
        rearrangeTabs(workspace);
      }
    }
  }

  public boolean isAutoRearrange() {
    return autoRearrange;
  }

  public Optional<Workspace> workspaceOf(TerminalWindow window) {
    return Optional.ofNullable(workspaceByWindow.get(window));
  }

  /**
   * @return workspaces, oldest first
   */
  public List<Workspace> workspaces() {
    return List.copyOf(workspaces.values());
  }

  public boolean contains(Workspace workspace) {
    return workspace != null && workspaces.get(workspace.id()) == workspace;
  }

  /**
   * Forgets every workspace. Used at shutdown.
   */
  public void clear() {
    confinement.check();
    workspaces.clear();
    workspaceByWindow.clear();
  }

  private double clampToMinimum(TerminalWindow window, double width) {
    if (Double.isNaN(width) || width < tabConfig.minimumWidth()) {
      LOGGER.warn("{} reported tab width {}; using {}", window, width, tabConfig.minimumWidth());
      return tabConfig.minimumWidth();
    }
    return width;
  }

  private void requireTracked(TerminalWindow window) {
    Validate.notNull(window, "window must not be null");
    if (!trackedWindow.test(window)) {
      throw new InvalidHandleException("Window " + window.id() + " is not tracked");
    }
  }

  private void requireKnown(Workspace workspace) {
    Validate.notNull(workspace, "workspace must not be null");
    if (!contains(workspace)) {
      throw new InvalidHandleException("Workspace " + workspace.id() + " is not known");
    }
  }
}
