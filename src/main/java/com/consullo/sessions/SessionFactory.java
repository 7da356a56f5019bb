package com.consullo.sessions;

import com.consullo.sessions.config.PreferenceStore;
import com.consullo.sessions.session.Session;
import com.consullo.sessions.session.SessionRegistry;
import com.consullo.sessions.session.SessionState;
import com.consullo.sessions.spawn.SpawnException;
import com.consullo.sessions.window.TerminalWindow;
import com.consullo.sessions.window.WindowRegistry;
import com.consullo.sessions.workspace.Workspace;
import com.consullo.sessions.workspace.WorkspaceManager;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points that create, clone and respawn sessions.
 *
 * <p>
 * A new session is tracked first, then its window is reconfigured (size,
 * title), then displayed (workspace placement, visibility, focus), and only
 * then is its process spawned. If spawning fails the session is disposed but
 * the window stays open.
 * </p>
 *
 * <p>Coordinating thread only.
 *
 * @since 1.0
 */
public final class SessionFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionFactory.class);

  private final SessionCoordinator coordinator;
  private final PreferenceStore preferences;

  SessionFactory(SessionCoordinator coordinator, PreferenceStore preferences) {
    this.coordinator = coordinator;
    this.preferences = preferences;
  }

  /**
   * Starts a session running a command.
   *
   * @param window tracked window to run in, or null to create one
   * @param commandLine argument vector
   * @param options settings, or null for defaults
   * @return the running session
   * @throws SpawnException if the process could not be started; the session is disposed by then
   */
  public Session newSessionFromCommand(TerminalWindow window, List<String> commandLine, SessionOptions options)
          throws SpawnException {
    coordinator.checkLive();
    Validate.notEmpty(commandLine, "commandLine must not be empty");
    SessionOptions opts = options != null ? options : SessionOptions.defaults();
    WindowRegistry windows = coordinator.windowRegistry();
    SessionRegistry sessions = coordinator.sessionRegistry();

    if (window != null && !windows.isTracked(window)) {
      throw new InvalidHandleException("Window " + window.id() + " is not tracked");
    }
    if (opts.getWorkspace() != null && !coordinator.workspaceManager().contains(opts.getWorkspace())) {
      throw new InvalidHandleException("Workspace " + opts.getWorkspace().id() + " is not known");
    }
    TerminalWindow target = window != null ? window : coordinator.createWindow();
    Path workingDirectory = opts.getWorkingDirectory() != null
            ? opts.getWorkingDirectory()
            : Path.of(".").toAbsolutePath().normalize();

    Session session = sessions.newSession(commandLine, workingDirectory);
    sessions.track(session, target);

    // Geometry must be final before the window is shown.
    if (opts.hasGeometry()) {
      target.screen().resize(opts.getColumns(), opts.getRows());
    }
    if (opts.getTitle() != null) {
      target.setCustomTitle(opts.getTitle());
    }
    display(session, opts.getWorkspace());

    try {
      coordinator.spawner().spawn(session, target, commandLine, workingDirectory);
    } catch (SpawnException e) {
      LOGGER.warn("Could not start {}: {} ({})", commandLine, e.getMessage(), e.failure());
      sessions.dispose(session, true);
      throw e;
    }
    sessions.transition(session, SessionState.ACTIVE_UNSTABLE);
    return session;
  }

  /**
   * Starts the configured default shell.
   *
   * @param options settings, or null for defaults
   * @return the running session
   * @throws SpawnException if the shell could not be started
   */
  public Session newSessionDefaultShell(SessionOptions options) throws SpawnException {
    return newSessionFromCommand(null, List.of(coordinator.config().defaultShell()), options);
  }

  /**
   * Starts the configured default shell as a login shell.
   *
   * @param options settings, or null for defaults
   * @return the running session
   * @throws SpawnException if the shell could not be started
   */
  public Session newSessionLoginShell(SessionOptions options) throws SpawnException {
    return newSessionFromCommand(null, List.of(coordinator.config().defaultShell(), "-l"), options);
  }

  /**
   * Starts a copy of a session in a new window placed next to the original.
   *
   * @param source tracked session
   * @return the new session
   * @throws SpawnException if the process could not be started
   */
  public Session cloneSession(Session source) throws SpawnException {
    coordinator.checkLive();
    Validate.notNull(source, "source must not be null");
    if (!coordinator.sessionRegistry().contains(source)) {
      throw new InvalidHandleException("Session " + source.id() + " is not tracked");
    }
    Workspace workspace = coordinator.workspaceManager().workspaceOf(source.window()).orElse(null);
    SessionOptions options = SessionOptions.builder()
            .workingDirectory(source.workingDirectory())
            .workspace(workspace)
            .build();
    return newSessionFromCommand(null, source.commandLine(), options);
  }

  /**
   * Starts a session described by a saved file.
   *
   * @param file saved session file
   * @param reader parser for the file
   * @return the running session
   * @throws IOException if the file cannot be read
   * @throws SpawnException if the process could not be started
   */
  public Session newSessionFromDescription(Path file, SessionDescriptionReader reader)
          throws IOException, SpawnException {
    Validate.notNull(file, "file must not be null");
    Validate.notNull(reader, "reader must not be null");
    SessionDescription description = reader.read(file);
    SessionOptions options = SessionOptions.builder()
            .workingDirectory(description.workingDirectory())
            .title(description.title())
            .build();
    return newSessionFromCommand(null, description.commandLine(), options);
  }

  /**
   * Restarts the process of a dead session in the same window.
   *
   * @param session tracked session
   * @return true if the session is running again; false if it was not dead or the spawn failed
   */
  public boolean respawnSession(Session session) {
    coordinator.checkLive();
    Validate.notNull(session, "session must not be null");
    if (!coordinator.sessionRegistry().contains(session)) {
      throw new InvalidHandleException("Session " + session.id() + " is not tracked");
    }
    if (session.state() != SessionState.DEAD) {
      LOGGER.warn("Cannot respawn session {} in state {}", session.id(), session.state());
      return false;
    }
    try {
      coordinator.spawner().respawn(session);
    } catch (SpawnException e) {
      LOGGER.warn("Respawn of session {} failed: {} ({})", session.id(), e.getMessage(), e.failure());
      return false;
    }
    coordinator.sessionRegistry().respawn(session);
    return true;
  }

  private void display(Session session, Workspace requested) {
    TerminalWindow window = session.window();
    WorkspaceManager workspaces = coordinator.workspaceManager();
    if (requested != null) {
      workspaces.addWindow(requested, window);
    } else if (workspaces.workspaceOf(window).isEmpty()) {
      if (preferences.useTabs()) {
        workspaces.addWindow(workspaces.activeWorkspace(), window);
      } else {
        workspaces.moveToNewWorkspace(window);
      }
    }
    coordinator.layout().setVisible(window, true);
    coordinator.focusSession(session);
  }
}
