package com.consullo.sessions.demo;

import com.consullo.sessions.CoordinatorEvent;
import com.consullo.sessions.CoordinatorEventLoop;
import com.consullo.sessions.SessionCoordinator;
import com.consullo.sessions.SessionOptions;
import com.consullo.sessions.config.CoordinatorConfig;
import com.consullo.sessions.session.Session;
import com.consullo.sessions.session.SessionState;
import com.consullo.sessions.window.HeadlessWindowLayout;
import com.consullo.sessions.window.TerminalWindow;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs two short shell commands as tabs of one workspace and prints what each
 * left on its screen once it exited.
 *
 * @since 1.0
 */
public final class CoordinatorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinatorDemo.class);

  private CoordinatorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args ignored
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    final CoordinatorConfig defaults = CoordinatorConfig.load();
    // Keep dead sessions so their screens can be read after exit.
    final CoordinatorConfig config = new CoordinatorConfig(
            defaults.averageTabWidth(), defaults.minimumTabWidth(), defaults.autoRearrangeTabs(),
            100, 5, defaults.maxHistoryLines(), defaults.defaultShell(), true, true);

    final CountDownLatch exited = new CountDownLatch(2);
    try (CoordinatorEventLoop loop = CoordinatorEventLoop.start(
            () -> SessionCoordinator.createDefault(config, new HeadlessWindowLayout(1200)))) {

      final List<Session> sessions = loop.submit(coordinator -> {
        coordinator.subscribe(CoordinatorEvent.SESSION_STATE_CHANGED, (kind, context) -> {
          Session session = (Session) context;
          LOGGER.info("{} is now {}", session, session.state());
          if (session.state() == SessionState.DEAD) {
            exited.countDown();
          }
        });
        Session first = coordinator.sessionFactory().newSessionFromCommand(null,
                List.of("/bin/sh", "-c", "printf '\\033]0;demo one\\007'; echo 'hello from one'"),
                SessionOptions.defaults());
        Session second = coordinator.sessionFactory().newSessionFromCommand(null,
                List.of("/bin/sh", "-c", "echo 'hello from two'; exit 3"),
                SessionOptions.builder().title("second").build());
        return List.of(first, second);
      }).get(10, TimeUnit.SECONDS);

      if (!exited.await(10, TimeUnit.SECONDS)) {
        LOGGER.warn("Sessions did not exit in time");
      }

      loop.submit(coordinator -> {
        coordinator.logState();
        for (Session session : sessions) {
          TerminalWindow window = session.window();
          System.out.println("=== " + session.title() + " (exit " + session.exitCode() + ") ===");
          for (String line : window.screen().readScreenLines()) {
            if (!line.isEmpty()) {
              System.out.println(line);
            }
          }
        }
        return null;
      }).get(10, TimeUnit.SECONDS);
    }
    LOGGER.info("Demo completed");
  }
}
