package com.consullo.sessions.session;

import com.consullo.sessions.CoordinatorEvent;
import com.consullo.sessions.InvalidHandleException;
import com.consullo.sessions.ThreadConfinement;
import com.consullo.sessions.config.PreferenceStore;
import com.consullo.sessions.hub.NotificationHub;
import com.consullo.sessions.window.TerminalWindow;
import com.consullo.sessions.window.WindowRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creation-ordered collection of sessions and owner of the session state machine.
 *
 * <p>
 * Every method must be called on the coordinating thread; mutations check it
 * and fail with {@link IllegalStateException} elsewhere. Sessions are handed
 * to the release handler supplied at construction once they reach
 * {@link SessionState#IMMINENT_DISPOSAL} and have been removed.
 * </p>
 *
 * @since 1.0
 */
public final class SessionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

  private final NotificationHub<CoordinatorEvent> hub;
  private final WindowRegistry windowRegistry;
  private final PreferenceStore preferences;
  private final ThreadConfinement confinement;
  private final Consumer<Session> releaseHandler;

  private final List<Session> sessionsInCreationOrder = new ArrayList<>();
  private final Map<Long, Session> sessionsById = new HashMap<>();
  private final Map<TerminalWindow, List<Session>> sessionsByWindow = new IdentityHashMap<>();
  private final Map<SessionState, Integer> countsByState = new EnumMap<>(SessionState.class);

  private long nextSessionId = 1;

  // > 0 while a non-snapshot enumeration is running
  private int iterationDepth;

  public SessionRegistry(
          NotificationHub<CoordinatorEvent> hub,
          WindowRegistry windowRegistry,
          PreferenceStore preferences,
          ThreadConfinement confinement,
          Consumer<Session> releaseHandler) {
    Validate.notNull(hub, "hub must not be null");
    Validate.notNull(windowRegistry, "windowRegistry must not be null");
    Validate.notNull(preferences, "preferences must not be null");
    Validate.notNull(confinement, "confinement must not be null");
    Validate.notNull(releaseHandler, "releaseHandler must not be null");
    this.hub = hub;
    this.windowRegistry = windowRegistry;
    this.preferences = preferences;
    this.confinement = confinement;
    this.releaseHandler = releaseHandler;
    for (SessionState state : SessionState.values()) {
      countsByState.put(state, 0);
    }
  }

  /**
   * Creates a session in {@link SessionState#BRAND_NEW}. It is not tracked until {@link #track}.
   *
   * @param commandLine process argument vector (not empty)
   * @param workingDirectory working directory for the process
   * @return new session
   */
  public Session newSession(List<String> commandLine, Path workingDirectory) {
    confinement.check();
    Validate.notEmpty(commandLine, "commandLine must not be empty");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    return new Session(nextSessionId++, commandLine, workingDirectory);
  }

  /**
   * Starts tracking a brand-new session and binds it to a window, which moves
   * it to {@link SessionState#INITIALIZED}.
   *
   * @param session session created by {@link #newSession}
   * @param window tracked window to bind
   */
  public void track(Session session, TerminalWindow window) {
    confinement.check();
    Validate.notNull(session, "session must not be null");
    Validate.notNull(window, "window must not be null");
    Validate.isTrue(!sessionsById.containsKey(session.id()), "session %s is already tracked", session.id());
    Validate.isTrue(session.state() == SessionState.BRAND_NEW, "only brand-new sessions can be tracked");
    if (!windowRegistry.isTracked(window)) {
      throw new InvalidHandleException("Window " + window.id() + " is not tracked");
    }
    checkMembershipMutable();

    sessionsInCreationOrder.add(session);
    sessionsById.put(session.id(), session);
    sessionsByWindow.computeIfAbsent(window, w -> new ArrayList<>()).add(session);
    countsByState.merge(SessionState.BRAND_NEW, 1, Integer::sum);

    session.setWindow(window);
    applyState(session, SessionState.INITIALIZED);
    LOGGER.info("Tracking {} in window {}", session, window.id());
    hub.publish(CoordinatorEvent.SESSION_COUNT_CHANGED, sessionsInCreationOrder.size());
  }

  /**
   * Moves a session forward in its lifecycle.
   *
   * <p>
   * Entering {@link SessionState#DEAD} consults
   * {@link PreferenceStore#keepWindowOpenOnExit()}: when false the session
   * continues straight to {@link SessionState#IMMINENT_DISPOSAL}. Entering
   * {@link SessionState#IMMINENT_DISPOSAL} removes the session and, if no other
   * session uses its window, stops tracking the window.
   * </p>
   *
   * @param session tracked session
   * @param next target state
   * @throws IllegalTransitionException if the current state cannot reach {@code next}
   */
  public void transition(Session session, SessionState next) {
    confinement.check();
    Validate.notNull(next, "next must not be null");
    requireTracked(session);
    SessionState current = session.state();
    if (!current.canTransitionTo(next)) {
      throw new IllegalTransitionException(session.id(), current, next);
    }
    if (next.ordinal() > SessionState.INITIALIZED.ordinal() && session.window() == null) {
      throw new IllegalTransitionException(session.id(), current, next);
    }
    if (next == SessionState.IMMINENT_DISPOSAL) {
      checkMembershipMutable();
    }

    applyState(session, next);

    if (next == SessionState.DEAD && !preferences.keepWindowOpenOnExit()) {
      transition(session, SessionState.IMMINENT_DISPOSAL);
    } else if (next == SessionState.IMMINENT_DISPOSAL) {
      remove(session, true);
    }
  }

  /**
   * Disposes a session whatever its state, passing through {@link SessionState#DEAD}.
   *
   * @param session tracked session
   * @param retainWindow if true the window stays tracked even if no session uses it
   */
  public void dispose(Session session, boolean retainWindow) {
    confinement.check();
    requireTracked(session);
    checkMembershipMutable();
    if (session.state().ordinal() < SessionState.DEAD.ordinal()) {
      applyState(session, SessionState.DEAD);
    }
    applyState(session, SessionState.IMMINENT_DISPOSAL);
    remove(session, !retainWindow);
  }

  /**
   * Disposes a session and releases its window if nothing else uses it.
   *
   * @param session tracked session
   */
  public void untrack(Session session) {
    confinement.check();
    dispose(session, false);
  }

  /**
   * Re-enters {@link SessionState#ACTIVE_UNSTABLE} after the process was restarted.
   *
   * @param session tracked session in {@link SessionState#DEAD}
   * @throws IllegalTransitionException if the session is not dead
   */
  public void respawn(Session session) {
    confinement.check();
    requireTracked(session);
    if (session.state() != SessionState.DEAD) {
      throw new IllegalTransitionException(session.id(), session.state(), SessionState.ACTIVE_UNSTABLE);
    }
    session.setExitCode(null);
    applyState(session, SessionState.ACTIVE_UNSTABLE);
  }

  /**
   * Records the exit code reported for the session's process.
   *
   * @param session tracked session
   * @param exitCode exit code
   */
  public void recordExit(Session session, int exitCode) {
    confinement.check();
    requireTracked(session);
    session.setExitCode(exitCode);
  }

  /**
   * Changes a session title, publishing {@link CoordinatorEvent#SESSION_TITLE_CHANGED} if it differs.
   *
   * @param session tracked session
   * @param title new title
   */
  public void updateTitle(Session session, String title) {
    confinement.check();
    requireTracked(session);
    String normalized = StringUtils.defaultString(title);
    if (normalized.equals(session.title())) {
      return;
    }
    session.setTitle(normalized);
    hub.publish(CoordinatorEvent.SESSION_TITLE_CHANGED, session);
  }

  public int count() {
    return sessionsInCreationOrder.size();
  }

  public int countInState(SessionState state) {
    Validate.notNull(state, "state must not be null");
    return countsByState.get(state);
  }

  public boolean contains(Session session) {
    return session != null && sessionsById.get(session.id()) == session;
  }

  public Optional<Session> find(long sessionId) {
    return Optional.ofNullable(sessionsById.get(sessionId));
  }

  /**
   * Returns a copy of the tracked sessions, oldest first.
   *
   * @return sessions in creation order
   */
  public List<Session> sessions() {
    return Collections.unmodifiableList(new ArrayList<>(sessionsInCreationOrder));
  }

  /**
   * Returns the sessions bound to a window, in the order they were bound.
   *
   * @param window window
   * @return sessions (empty if none)
   */
  public List<Session> sessionsIn(TerminalWindow window) {
    List<Session> sessions = sessionsByWindow.get(window);
    return sessions == null ? List.of() : List.copyOf(sessions);
  }

  /**
   * Visits the sessions matching a predicate, in creation order.
   *
   * <p>
   * With {@code snapshot} true the visit runs over a copy taken before the first
   * callback, so the callback may dispose sessions (including ones not yet
   * visited, which are then still visited). With {@code snapshot} false the
   * live list is used and any track or removal from inside the callback fails
   * with {@link IllegalStateException}.
   * </p>
   *
   * @param filter predicate, evaluated when each session is reached
   * @param snapshot whether to iterate over a point-in-time copy
   * @param callback visitor
   */
  public void allMatching(Predicate<Session> filter, boolean snapshot, Consumer<Session> callback) {
    confinement.check();
    Validate.notNull(filter, "filter must not be null");
    Validate.notNull(callback, "callback must not be null");

    if (snapshot) {
      for (Session session : new ArrayList<>(sessionsInCreationOrder)) {
        if (filter.test(session)) {
          callback.accept(session);
        }
      }
      return;
    }

    iterationDepth++;
    try {
      for (int i = 0; i < sessionsInCreationOrder.size(); i++) {
        Session session = sessionsInCreationOrder.get(i);
        if (filter.test(session)) {
          callback.accept(session);
        }
      }
    } finally {
      iterationDepth--;
    }
  }

  /**
   * Forgets every session without running the state machine. Used at shutdown
   * after the processes have been released.
   */
  public void clear() {
    confinement.check();
    checkMembershipMutable();
    sessionsInCreationOrder.clear();
    sessionsById.clear();
    sessionsByWindow.clear();
    for (SessionState state : SessionState.values()) {
      countsByState.put(state, 0);
    }
  }

  private void applyState(Session session, SessionState next) {
    SessionState previous = session.state();
    session.setState(next);
    countsByState.merge(previous, -1, Integer::sum);
    countsByState.merge(next, 1, Integer::sum);
    LOGGER.debug("Session {}: {} -> {}", session.id(), previous, next);

    if (next == SessionState.ACTIVE_UNSTABLE) {
      seedTitle(session);
    }
    hub.publish(CoordinatorEvent.SESSION_STATE_CHANGED, session);
  }

  private void seedTitle(Session session) {
    TerminalWindow window = session.window();
    String title;
    if (window.customTitle() != null) {
      title = window.customTitle();
    } else if (StringUtils.isNotBlank(window.screen().title())) {
      title = window.screen().title();
    } else {
      title = session.resourceLocation();
    }
    updateTitle(session, title);
  }

  private void remove(Session session, boolean releaseWindow) {
    sessionsInCreationOrder.remove(session);
    sessionsById.remove(session.id());
    countsByState.merge(session.state(), -1, Integer::sum);

    TerminalWindow window = session.window();
    List<Session> windowSessions = sessionsByWindow.get(window);
    if (windowSessions != null) {
      windowSessions.remove(session);
      if (windowSessions.isEmpty()) {
        sessionsByWindow.remove(window);
        if (releaseWindow && windowRegistry.isTracked(window)) {
          windowRegistry.untrack(window);
        }
      }
    }

    LOGGER.info("Disposed {}", session);
    hub.publish(CoordinatorEvent.SESSION_COUNT_CHANGED, sessionsInCreationOrder.size());
    releaseHandler.accept(session);
  }

  private void requireTracked(Session session) {
    Validate.notNull(session, "session must not be null");
    if (!contains(session)) {
      throw new InvalidHandleException("Session " + session.id() + " is not tracked");
    }
  }

  private void checkMembershipMutable() {
    Validate.validState(iterationDepth == 0, "sessions cannot be added or removed during a non-snapshot enumeration");
  }
}
