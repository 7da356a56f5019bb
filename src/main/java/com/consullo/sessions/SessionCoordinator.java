package com.consullo.sessions;

import com.consullo.sessions.config.CoordinatorConfig;
import com.consullo.sessions.config.PreferenceStore;
import com.consullo.sessions.hub.NotificationHub;
import com.consullo.sessions.hub.NotificationListener;
import com.consullo.sessions.hub.Subscription;
import com.consullo.sessions.marshal.MarshalledRequest;
import com.consullo.sessions.marshal.RequestMarshaller;
import com.consullo.sessions.screen.JediTermScreen;
import com.consullo.sessions.session.IllegalTransitionException;
import com.consullo.sessions.session.Session;
import com.consullo.sessions.session.SessionFilter;
import com.consullo.sessions.session.SessionRegistry;
import com.consullo.sessions.session.SessionState;
import com.consullo.sessions.spawn.ProcessSpawner;
import com.consullo.sessions.spawn.Pty4jProcessSpawner;
import com.consullo.sessions.spawn.SpawnException;
import com.consullo.sessions.window.TerminalWindow;
import com.consullo.sessions.window.WindowLayout;
import com.consullo.sessions.window.WindowRegistry;
import com.consullo.sessions.workspace.Workspace;
import com.consullo.sessions.workspace.WorkspaceManager;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the session, window and workspace registries and the notification hub,
 * and applies requests marshalled from background threads.
 *
 * <p>
 * The thread that calls {@link #init()} becomes the coordinating thread. Every
 * method except {@link #post} must be called on it; calls from any other
 * thread fail with {@link IllegalStateException}. Background threads never
 * touch the registries: they {@link #post} requests, which are applied when the
 * coordinating thread calls {@link #processPendingRequests()} or
 * {@link #processRequests(long, TimeUnit)}. A request naming a session that is
 * gone by then is dropped without effect.
 * </p>
 *
 * @since 1.0
 */
public final class SessionCoordinator implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionCoordinator.class);

  private final CoordinatorConfig config;
  private final WindowLayout layout;
  private final RequestMarshaller marshaller;
  private final ProcessSpawner spawner;

  private final NotificationHub<CoordinatorEvent> hub = new NotificationHub<>();
  private final WorkspaceManager workspaceManager;
  private final WindowRegistry windowRegistry;
  private final SessionRegistry sessionRegistry;
  private final SessionFactory sessionFactory;

  private final ThreadConfinement confinement = new ThreadConfinement();
  private boolean shutDown;
  private Session focusedSession;

  /**
   * @param config configuration
   * @param preferences preference lookup consulted at exit and display time
   * @param layout window layout collaborator
   * @param marshaller queue background threads post to; the spawner should post to the same one
   * @param spawner process spawner
   */
  public SessionCoordinator(
          CoordinatorConfig config,
          PreferenceStore preferences,
          WindowLayout layout,
          RequestMarshaller marshaller,
          ProcessSpawner spawner) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(preferences, "preferences must not be null");
    Validate.notNull(layout, "layout must not be null");
    Validate.notNull(marshaller, "marshaller must not be null");
    Validate.notNull(spawner, "spawner must not be null");
    this.config = config;
    this.layout = layout;
    this.marshaller = marshaller;
    this.spawner = spawner;

    this.workspaceManager = new WorkspaceManager(hub, layout, config.tabLayout(), confinement,
            this::focusedWindow, this::isTrackedWindow, config.autoRearrangeTabs());
    this.windowRegistry = new WindowRegistry(
            hub, layout, confinement, workspaceManager::removeWindow, this::hostsSessions);
    this.sessionRegistry = new SessionRegistry(
            hub, windowRegistry, preferences, confinement, this::releaseSession);
    this.sessionFactory = new SessionFactory(this, preferences);
  }

  /**
   * Coordinator using pty4j processes and {@code config} as its preference store.
   *
   * @param config configuration
   * @param layout window layout collaborator
   * @return coordinator, not yet initialized
   */
  public static SessionCoordinator createDefault(CoordinatorConfig config, WindowLayout layout) {
    RequestMarshaller marshaller = new RequestMarshaller();
    return new SessionCoordinator(config, config, layout, marshaller, new Pty4jProcessSpawner(marshaller));
  }

  /**
   * Makes the calling thread the coordinating thread.
   *
   * @throws IllegalStateException if already initialized
   */
  public void init() {
    confinement.bindToCurrentThread();
    LOGGER.info("Coordinator initialized on thread {}", confinement.owner().getName());
  }

  /**
   * Stops accepting requests, discards the queued ones, releases every process
   * and forgets all sessions, windows, workspaces and subscriptions.
   */
  public void shutdown() {
    confinement.check();
    if (shutDown) {
      return;
    }
    shutDown = true;
    int discarded = marshaller.shutdown();
    sessionRegistry.allMatching(SessionFilter.ALL, true, spawner::release);
    int sessions = sessionRegistry.count();
    sessionRegistry.clear();
    windowRegistry.forEach(window -> layout.setVisible(window, false));
    windowRegistry.clear();
    workspaceManager.clear();
    hub.clear();
    focusedSession = null;
    LOGGER.info("Coordinator shut down: released {} sessions, discarded {} requests", sessions, discarded);
  }

  @Override
  public void close() {
    shutdown();
  }

  // ---- cross-thread path ----

  /**
   * Queues a request for the coordinating thread. Safe from any thread.
   *
   * @param request request
   * @return false if the coordinator is shut down and the request was dropped
   */
  public boolean post(MarshalledRequest request) {
    return marshaller.post(request);
  }

  /**
   * Applies every queued request without waiting.
   *
   * @return number of requests taken from the queue
   */
  public int processPendingRequests() {
    checkLive();
    return marshaller.drain(this::apply);
  }

  /**
   * Waits up to the timeout for requests, then applies everything queued.
   *
   * @param timeout maximum wait
   * @param unit timeout unit
   * @return number of requests taken from the queue
   * @throws InterruptedException if interrupted while waiting
   */
  public int processRequests(long timeout, TimeUnit unit) throws InterruptedException {
    checkLive();
    return marshaller.awaitAndDrain(timeout, unit, this::apply);
  }

  private void apply(MarshalledRequest request) {
    Optional<Session> found = sessionRegistry.find(request.sessionId());
    if (found.isEmpty()) {
      LOGGER.debug("Dropping stale {}", request);
      return;
    }
    Session session = found.get();
    switch (request.type()) {
      case DATA_ARRIVED:
        applyOutput(session, request.data());
        break;
      case PROCESS_EXITED:
        applyExit(session, request.exitCode());
        break;
      case STATE_CHANGE:
        try {
          sessionRegistry.transition(session, request.targetState());
        } catch (IllegalTransitionException e) {
          LOGGER.warn("Ignoring requested transition: {}", e.getMessage());
        }
        break;
      default:
        throw new IllegalStateException("Unhandled request type " + request.type());
    }
  }

  private void applyOutput(Session session, byte[] data) {
    TerminalWindow window = session.window();
    String titleBefore = window.screen().title();
    window.screen().feed(data, 0, data.length);

    if (session.state() == SessionState.ACTIVE_UNSTABLE) {
      sessionRegistry.transition(session, SessionState.ACTIVE_STABLE);
    }
    String titleAfter = window.screen().title();
    if (window.customTitle() == null && StringUtils.isNotBlank(titleAfter) && !titleAfter.equals(titleBefore)) {
      for (Session windowSession : sessionRegistry.sessionsIn(window)) {
        sessionRegistry.updateTitle(windowSession, titleAfter);
      }
    }
  }

  private void applyExit(Session session, int exitCode) {
    if (session.state().ordinal() >= SessionState.DEAD.ordinal()) {
      LOGGER.debug("Session {} already {}, ignoring exit code {}", session.id(), session.state(), exitCode);
      return;
    }
    LOGGER.info("Session {} exited with code {}", session.id(), exitCode);
    sessionRegistry.recordExit(session, exitCode);
    sessionRegistry.transition(session, SessionState.DEAD);
  }

  // ---- notifications ----

  public Subscription<CoordinatorEvent> subscribe(CoordinatorEvent kind, NotificationListener<CoordinatorEvent> listener) {
    confinement.check();
    return hub.subscribe(kind, listener);
  }

  public void unsubscribe(Subscription<CoordinatorEvent> subscription) {
    confinement.check();
    hub.unsubscribe(subscription);
  }

  // ---- enumeration and queries ----

  /**
   * Visits sessions in creation order.
   *
   * @param filter which sessions to visit
   * @param snapshot must be true if the callback may dispose sessions
   * @param callback visitor
   */
  public void forEachSession(SessionFilter filter, boolean snapshot, Consumer<Session> callback) {
    checkLive();
    sessionRegistry.allMatching(filter, snapshot, callback);
  }

  /**
   * Visits tracked windows in creation order. The callback must not close windows.
   *
   * @param callback visitor
   */
  public void forEachWindow(Consumer<TerminalWindow> callback) {
    checkLive();
    windowRegistry.forEach(callback);
  }

  public int sessionCount() {
    confinement.check();
    return sessionRegistry.count();
  }

  public int countInState(SessionState state) {
    confinement.check();
    return sessionRegistry.countInState(state);
  }

  public List<Session> sessionsIn(TerminalWindow window) {
    confinement.check();
    return sessionRegistry.sessionsIn(window);
  }

  // ---- user focus ----

  /**
   * Records the session the user works in and focuses its window.
   *
   * @param session tracked session
   */
  public void focusSession(Session session) {
    checkLive();
    requireTracked(session);
    layout.focus(session.window());
    if (focusedSession != session) {
      focusedSession = session;
      hub.publish(CoordinatorEvent.ACTIVE_SESSION_CHANGED, session);
    }
  }

  /**
   * Returns the focused session, or else the newest session that is not dead.
   *
   * @return most relevant session for user commands
   */
  public Optional<Session> userRecentSession() {
    confinement.check();
    if (focusedSession != null) {
      return Optional.of(focusedSession);
    }
    List<Session> sessions = sessionRegistry.sessions();
    for (int i = sessions.size() - 1; i >= 0; i--) {
      if (sessions.get(i).state().ordinal() < SessionState.DEAD.ordinal()) {
        return Optional.of(sessions.get(i));
      }
    }
    return Optional.empty();
  }

  // ---- session and window commands ----

  /**
   * Sets the operator title of the session's window, which also becomes the
   * title of every session in that window.
   *
   * @param session tracked session
   * @param title new title
   */
  public void renameSession(Session session, String title) {
    checkLive();
    requireTracked(session);
    Validate.notBlank(title, "title must not be blank");
    TerminalWindow window = session.window();
    window.setCustomTitle(title);
    for (Session windowSession : sessionRegistry.sessionsIn(window)) {
      sessionRegistry.updateTitle(windowSession, title);
    }
  }

  /**
   * Types text into a session's process.
   *
   * @param session tracked session
   * @param text text to send
   * @throws SpawnException if the session has no running process
   */
  public void sendInput(Session session, String text) throws SpawnException {
    checkLive();
    requireTracked(session);
    Validate.notNull(text, "text must not be null");
    spawner.write(session, text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Disposes every session of a window, then stops tracking and hides the window.
   *
   * @param window tracked window
   */
  public void closeWindow(TerminalWindow window) {
    checkLive();
    if (!windowRegistry.isTracked(window)) {
      throw new InvalidHandleException("Window " + (window == null ? null : window.id()) + " is not tracked");
    }
    for (Session session : sessionRegistry.sessionsIn(window)) {
      sessionRegistry.dispose(session, true);
    }
    windowRegistry.untrack(window);
  }

  /**
   * Writes one line per session and workspace to the log.
   */
  public void logState() {
    confinement.check();
    LOGGER.info("{} sessions, {} windows, {} workspaces",
            sessionRegistry.count(), windowRegistry.count(), workspaceManager.workspaces().size());
    for (Session session : sessionRegistry.sessions()) {
      LOGGER.info("  {} window={} exit={}{}", session, session.window().id(), session.exitCode(),
              session == focusedSession ? " (focused)" : "");
    }
    for (Workspace workspace : workspaceManager.workspaces()) {
      LOGGER.info("  {}", workspace);
    }
  }

  // ---- components ----

  public SessionFactory sessionFactory() {
    return sessionFactory;
  }

  public SessionRegistry sessionRegistry() {
    return sessionRegistry;
  }

  public WindowRegistry windowRegistry() {
    return windowRegistry;
  }

  public WorkspaceManager workspaceManager() {
    return workspaceManager;
  }

  public WindowLayout layout() {
    return layout;
  }

  public CoordinatorConfig config() {
    return config;
  }

  ProcessSpawner spawner() {
    return spawner;
  }

  /**
   * Creates and tracks a window with a screen of the default size.
   *
   * @return new tracked window
   */
  TerminalWindow createWindow() {
    TerminalWindow window = windowRegistry.newWindow(
            new JediTermScreen(config.defaultColumns(), config.defaultRows(), config.maxHistoryLines()));
    windowRegistry.track(window);
    return window;
  }

  void checkLive() {
    confinement.check();
    Validate.validState(!shutDown, "coordinator is shut down");
  }

  private void requireTracked(Session session) {
    Validate.notNull(session, "session must not be null");
    if (!sessionRegistry.contains(session)) {
      throw new InvalidHandleException("Session " + session.id() + " is not tracked");
    }
  }

  private boolean isTrackedWindow(TerminalWindow window) {
    return windowRegistry.isTracked(window);
  }

  private boolean hostsSessions(TerminalWindow window) {
    return !sessionRegistry.sessionsIn(window).isEmpty();
  }

  private TerminalWindow focusedWindow() {
    return focusedSession != null ? focusedSession.window() : null;
  }

  private void releaseSession(Session session) {
    if (focusedSession == session) {
      focusedSession = null;
    }
    spawner.release(session);
  }
}
