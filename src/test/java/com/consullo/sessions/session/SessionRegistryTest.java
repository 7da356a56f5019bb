package com.consullo.sessions.session;

import com.consullo.sessions.CoordinatorEvent;
import com.consullo.sessions.InvalidHandleException;
import com.consullo.sessions.ThreadConfinement;
import com.consullo.sessions.config.PreferenceStore;
import com.consullo.sessions.hub.NotificationHub;
import com.consullo.sessions.screen.TerminalScreen;
import com.consullo.sessions.window.HeadlessWindowLayout;
import com.consullo.sessions.window.TerminalWindow;
import com.consullo.sessions.window.WindowRegistry;
import com.consullo.sessions.workspace.TabLayoutConfig;
import com.consullo.sessions.workspace.WorkspaceManager;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for session tracking and the session state machine.
 *
 * @since 1.0
 */
public class SessionRegistryTest {

  private static final Path WORK_DIR = Path.of("/tmp");

  private NotificationHub<CoordinatorEvent> hub;
  private WindowRegistry windows;
  private WorkspaceManager workspaces;
  private PreferenceStore preferences;
  private SessionRegistry registry;
  private TerminalScreen screen;

  private final List<Session> released = new ArrayList<>();
  private final List<CoordinatorEvent> events = new ArrayList<>();
  private final Map<Long, List<SessionState>> observedStates = new HashMap<>();

  @BeforeEach
  void setUp() {
    hub = new NotificationHub<>();
    HeadlessWindowLayout layout = new HeadlessWindowLayout(1000);
    ThreadConfinement confinement = new ThreadConfinement();
    confinement.bindToCurrentThread();
    windows = new WindowRegistry(hub, layout, confinement,
            w -> workspaces.removeWindow(w), w -> !registry.sessionsIn(w).isEmpty());
    workspaces = new WorkspaceManager(
            hub, layout, new TabLayoutConfig(320, 48), confinement, () -> null, windows::isTracked, true);
    preferences = mock(PreferenceStore.class);
    registry = new SessionRegistry(hub, windows, preferences, confinement, released::add);

    screen = mock(TerminalScreen.class);
    when(screen.title()).thenReturn("");

    for (CoordinatorEvent kind : CoordinatorEvent.values()) {
      hub.subscribe(kind, (k, context) -> events.add(k));
    }
    hub.subscribe(CoordinatorEvent.SESSION_STATE_CHANGED, (k, context) -> {
      Session session = (Session) context;
      observedStates.computeIfAbsent(session.id(), id -> new ArrayList<>()).add(session.state());
    });
  }

  private TerminalWindow trackedWindow() {
    TerminalWindow window = windows.newWindow(screen);
    windows.track(window);
    return window;
  }

  private Session trackedSession(TerminalWindow window, String... commandLine) {
    Session session = registry.newSession(List.of(commandLine), WORK_DIR);
    registry.track(session, window);
    return session;
  }

  private Session activeSession(TerminalWindow window) {
    Session session = trackedSession(window, "/bin/sh");
    registry.transition(session, SessionState.ACTIVE_UNSTABLE);
    registry.transition(session, SessionState.ACTIVE_STABLE);
    return session;
  }

  @Test
  @DisplayName("Should initialize a session when it is bound to a window")
  void track_BrandNewSession_InitializesAndPublishesCount() {
    TerminalWindow window = trackedWindow();
    events.clear();

    Session session = trackedSession(window, "/bin/sh");

    assertThat(session.state()).isEqualTo(SessionState.INITIALIZED);
    assertThat(session.window()).isSameAs(window);
    assertThat(registry.count()).isEqualTo(1);
    assertThat(registry.sessionsIn(window)).containsExactly(session);
    assertThat(events).containsExactly(CoordinatorEvent.SESSION_STATE_CHANGED, CoordinatorEvent.SESSION_COUNT_CHANGED);
  }

  @Test
  @DisplayName("Should refuse to bind a session to an untracked window")
  void track_UntrackedWindow_Throws() {
    Session session = registry.newSession(List.of("/bin/sh"), WORK_DIR);

    assertThatThrownBy(() -> registry.track(session, windows.newWindow(screen)))
            .isInstanceOf(InvalidHandleException.class);
    assertThat(registry.count()).isZero();
  }

  @Test
  @DisplayName("Should reject a backward transition and leave the registry unchanged")
  void transition_Backward_ThrowsAndLeavesState() {
    Session session = activeSession(trackedWindow());

    assertThatThrownBy(() -> registry.transition(session, SessionState.ACTIVE_UNSTABLE))
            .isInstanceOf(IllegalTransitionException.class);
    assertThat(session.state()).isEqualTo(SessionState.ACTIVE_STABLE);
    assertThat(registry.countInState(SessionState.ACTIVE_STABLE)).isEqualTo(1);
  }

  @Test
  @DisplayName("Should reject disposal of a session that is not dead")
  void transition_DisposalFromActive_Throws() {
    Session session = activeSession(trackedWindow());

    assertThatThrownBy(() -> registry.transition(session, SessionState.IMMINENT_DISPOSAL))
            .isInstanceOf(IllegalTransitionException.class);
    assertThat(registry.contains(session)).isTrue();
  }

  @Test
  @DisplayName("Should reject operations on an untracked session")
  void transition_UntrackedSession_ThrowsInvalidHandle() {
    Session session = registry.newSession(List.of("/bin/sh"), WORK_DIR);

    assertThatThrownBy(() -> registry.transition(session, SessionState.INITIALIZED))
            .isInstanceOf(InvalidHandleException.class);
  }

  @Test
  @DisplayName("Should dispose a dead session and release its window when windows close on exit")
  void transition_DeadWithoutKeepOpen_DisposesAndUntracksWindow() {
    when(preferences.keepWindowOpenOnExit()).thenReturn(false);
    TerminalWindow window = trackedWindow();
    Session session = activeSession(window);
    events.clear();

    registry.transition(session, SessionState.DEAD);

    assertThat(session.state()).isEqualTo(SessionState.IMMINENT_DISPOSAL);
    assertThat(registry.contains(session)).isFalse();
    assertThat(registry.count()).isZero();
    assertThat(windows.isTracked(window)).isFalse();
    assertThat(released).containsExactly(session);
    assertThat(events).filteredOn(e -> e == CoordinatorEvent.SESSION_COUNT_CHANGED).hasSize(1);
  }

  @Test
  @DisplayName("Should keep a dead session when windows stay open on exit")
  void transition_DeadWithKeepOpen_StaysDead() {
    when(preferences.keepWindowOpenOnExit()).thenReturn(true);
    TerminalWindow window = trackedWindow();
    Session session = activeSession(window);

    registry.transition(session, SessionState.DEAD);

    assertThat(session.state()).isEqualTo(SessionState.DEAD);
    assertThat(registry.countInState(SessionState.DEAD)).isEqualTo(1);
    assertThat(windows.isTracked(window)).isTrue();
    assertThat(released).isEmpty();
  }

  @Test
  @DisplayName("Should keep a window tracked while another session still uses it")
  void untrack_WindowSharedBySessions_WindowSurvivesUntilLastSession() {
    TerminalWindow window = trackedWindow();
    Session first = trackedSession(window, "/bin/sh");
    Session second = trackedSession(window, "/bin/bash");

    registry.untrack(first);
    assertThat(windows.isTracked(window)).isTrue();
    assertThat(registry.sessionsIn(window)).containsExactly(second);

    registry.untrack(second);
    assertThat(windows.isTracked(window)).isFalse();
    assertThat(registry.sessionsIn(window)).isEmpty();
  }

  @Test
  @DisplayName("Should keep the window when disposing with retainWindow")
  void dispose_RetainWindow_WindowStaysTracked() {
    TerminalWindow window = trackedWindow();
    Session session = trackedSession(window, "/bin/sh");

    registry.dispose(session, true);

    assertThat(registry.contains(session)).isFalse();
    assertThat(windows.isTracked(window)).isTrue();
    assertThat(observedStates.get(session.id()))
            .containsExactly(SessionState.INITIALIZED, SessionState.DEAD, SessionState.IMMINENT_DISPOSAL);
  }

  @Test
  @DisplayName("Should refuse to respawn a session that is not dead")
  void respawn_ActiveSession_ThrowsAndLeavesState() {
    Session session = trackedSession(trackedWindow(), "/bin/sh");
    registry.transition(session, SessionState.ACTIVE_UNSTABLE);

    assertThatThrownBy(() -> registry.respawn(session)).isInstanceOf(IllegalTransitionException.class);
    assertThat(session.state()).isEqualTo(SessionState.ACTIVE_UNSTABLE);
  }

  @Test
  @DisplayName("Should return a dead session to active-unstable without a new entry")
  void respawn_DeadSession_ReentersActiveUnstable() {
    when(preferences.keepWindowOpenOnExit()).thenReturn(true);
    Session session = activeSession(trackedWindow());
    registry.recordExit(session, 1);
    registry.transition(session, SessionState.DEAD);

    registry.respawn(session);

    assertThat(session.state()).isEqualTo(SessionState.ACTIVE_UNSTABLE);
    assertThat(session.exitCode()).isNull();
    assertThat(registry.count()).isEqualTo(1);
    assertThat(registry.countInState(SessionState.DEAD)).isZero();
  }

  @Test
  @DisplayName("Should seed the title from the command line when nothing better is known")
  void transition_ActiveUnstableWithoutTitles_SeedsResourceLocation() {
    Session session = trackedSession(trackedWindow(), "/usr/bin/top", "-d", "1");

    registry.transition(session, SessionState.ACTIVE_UNSTABLE);

    assertThat(session.title()).isEqualTo("/usr/bin/top -d 1");
  }

  @Test
  @DisplayName("Should seed the title from the screen title the process set")
  void transition_ActiveUnstableWithScreenTitle_SeedsScreenTitle() {
    when(screen.title()).thenReturn("htop");
    Session session = trackedSession(trackedWindow(), "/usr/bin/htop");

    registry.transition(session, SessionState.ACTIVE_UNSTABLE);

    assertThat(session.title()).isEqualTo("htop");
  }

  @Test
  @DisplayName("Should prefer the operator-assigned window title")
  void transition_ActiveUnstableWithCustomTitle_UsesCustomTitle() {
    when(screen.title()).thenReturn("htop");
    TerminalWindow window = trackedWindow();
    window.setCustomTitle("monitoring");
    Session session = trackedSession(window, "/usr/bin/htop");

    registry.transition(session, SessionState.ACTIVE_UNSTABLE);

    assertThat(session.title()).isEqualTo("monitoring");
  }

  @Test
  @DisplayName("Should keep per-state counts summing to the total")
  void countInState_AfterMixedOperations_SumsToCount() {
    when(preferences.keepWindowOpenOnExit()).thenReturn(true);
    TerminalWindow window = trackedWindow();
    Session a = activeSession(window);
    Session b = trackedSession(window, "/bin/sh");
    Session c = activeSession(trackedWindow());
    trackedSession(trackedWindow(), "/bin/sh");
    registry.transition(a, SessionState.DEAD);
    registry.untrack(b);
    registry.transition(c, SessionState.DEAD);
    registry.respawn(c);

    int sum = 0;
    for (SessionState state : SessionState.values()) {
      sum += registry.countInState(state);
    }
    assertThat(sum).isEqualTo(registry.count()).isEqualTo(3);
    assertThat(registry.countInState(SessionState.DEAD)).isEqualTo(1);
    assertThat(registry.countInState(SessionState.ACTIVE_UNSTABLE)).isEqualTo(1);
    assertThat(registry.countInState(SessionState.INITIALIZED)).isEqualTo(1);
  }

  @Test
  @DisplayName("Should visit every session exactly once when the callback disposes them")
  void allMatching_SnapshotCallbackDisposesAll_VisitsEachOnce() {
    TerminalWindow window = trackedWindow();
    List<Session> created = List.of(
            trackedSession(window, "a"), trackedSession(window, "b"), trackedSession(trackedWindow(), "c"));
    List<Session> visited = new ArrayList<>();

    registry.allMatching(SessionFilter.ALL, true, session -> {
      visited.add(session);
      for (Session s : registry.sessions()) {
        registry.untrack(s);
      }
    });

    assertThat(visited).containsExactlyElementsOf(created);
    assertThat(registry.count()).isZero();
    assertThat(windows.count()).isZero();
  }

  @Test
  @DisplayName("Should fail when a non-snapshot enumeration removes sessions")
  void allMatching_LiveCallbackDisposes_ThrowsAndLeavesRegistry() {
    Session session = trackedSession(trackedWindow(), "/bin/sh");

    assertThatThrownBy(() -> registry.allMatching(SessionFilter.ALL, false, registry::untrack))
            .isInstanceOf(IllegalStateException.class);
    assertThat(registry.contains(session)).isTrue();
    assertThat(session.state()).isEqualTo(SessionState.INITIALIZED);

    // the guard is lifted once the enumeration ends
    registry.untrack(session);
    assertThat(registry.count()).isZero();
  }

  @Test
  @DisplayName("Should apply the filter to each visited session")
  void allMatching_ActiveFilter_VisitsActiveOnly() {
    TerminalWindow window = trackedWindow();
    Session active = activeSession(window);
    trackedSession(window, "/bin/sh");
    List<Session> visited = new ArrayList<>();

    registry.allMatching(SessionFilter.ACTIVE, false, visited::add);

    assertThat(visited).containsExactly(active);
  }

  @Test
  @DisplayName("Should observe only forward states and exactly one disposal per session")
  void lifecycle_FullRun_StatesAreMonotonic() {
    when(preferences.keepWindowOpenOnExit()).thenReturn(false);
    Session crashed = trackedSession(trackedWindow(), "a");
    registry.transition(crashed, SessionState.ACTIVE_UNSTABLE);
    registry.transition(crashed, SessionState.DEAD);
    Session normal = activeSession(trackedWindow());
    registry.transition(normal, SessionState.DEAD);
    Session neverStarted = trackedSession(trackedWindow(), "c");
    registry.untrack(neverStarted);

    for (List<SessionState> states : observedStates.values()) {
      for (int i = 1; i < states.size(); i++) {
        assertThat(states.get(i).ordinal()).isGreaterThan(states.get(i - 1).ordinal());
      }
      assertThat(states).filteredOn(s -> s == SessionState.IMMINENT_DISPOSAL).hasSize(1);
      assertThat(states.get(states.size() - 2)).isEqualTo(SessionState.DEAD);
    }
    assertThat(observedStates).hasSize(3);
  }
}
