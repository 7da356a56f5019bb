package com.consullo.sessions.spawn;

import com.consullo.sessions.marshal.MarshalledRequest;
import com.consullo.sessions.marshal.RequestMarshaller;
import com.consullo.sessions.session.Session;
import com.consullo.sessions.window.TerminalWindow;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessSpawner} running each session's process on a pseudo-terminal.
 *
 * <p>
 * Each process gets a daemon reader thread that posts its output as
 * {@link MarshalledRequest#dataArrived} requests, and its exit is posted as a
 * {@link MarshalledRequest#processExited} request. A process replaced by a
 * respawn or released no longer posts its exit.
 * </p>
 *
 * @since 1.0
 */
public final class Pty4jProcessSpawner implements ProcessSpawner {

  private static final Logger LOGGER = LoggerFactory.getLogger(Pty4jProcessSpawner.class);

  private static final int READ_BUFFER_SIZE = 8192;

  /**
   * Starts a controller for a configuration.
   */
  @FunctionalInterface
  public interface Launcher {
    PtyProcessController launch(PtyProcessConfig config) throws IOException;
  }

  private static final class Attachment {
    final PtyProcessConfig config;
    final PtyProcessController controller;

    Attachment(PtyProcessConfig config, PtyProcessController controller) {
      this.config = config;
      this.controller = controller;
    }
  }

  private final RequestMarshaller marshaller;
  private final Map<String, String> environment;
  private final Launcher launcher;

  // Written on the coordinating thread, read by exit callbacks.
  private final Map<Long, Attachment> attachments = new ConcurrentHashMap<>();

  /**
   * Spawner using pty4j, with the current environment plus {@code TERM=xterm-256color}.
   *
   * @param marshaller queue receiving output and exit requests
   */
  public Pty4jProcessSpawner(RequestMarshaller marshaller) {
    this(marshaller, defaultEnvironment(), PtyProcessControllerPty4j::new);
  }

  /**
   * @param marshaller queue receiving output and exit requests
   * @param environment complete environment for spawned processes
   * @param launcher starts controllers
   */
  public Pty4jProcessSpawner(RequestMarshaller marshaller, Map<String, String> environment, Launcher launcher) {
    Validate.notNull(marshaller, "marshaller must not be null");
    Validate.notNull(environment, "environment must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    this.marshaller = marshaller;
    this.environment = Map.copyOf(environment);
    this.launcher = launcher;
  }

  @Override
  public void spawn(Session session, TerminalWindow window, List<String> commandLine, Path workingDirectory)
          throws SpawnException {
    Validate.notNull(session, "session must not be null");
    Validate.notNull(window, "window must not be null");
    if (commandLine == null || commandLine.isEmpty()) {
      throw new SpawnException(SpawnFailure.PARAMETER_ERROR, "command line must not be empty");
    }
    if (workingDirectory == null || !Files.isDirectory(workingDirectory)) {
      throw new SpawnException(SpawnFailure.PARAMETER_ERROR, "not a directory: " + workingDirectory);
    }
    PtyProcessConfig config = new PtyProcessConfig(
            commandLine,
            workingDirectory,
            environment,
            window.screen().columns(),
            window.screen().rows());
    start(session.id(), config);
  }

  @Override
  public void respawn(Session session) throws SpawnException {
    Validate.notNull(session, "session must not be null");
    Attachment previous = attachments.get(session.id());
    if (previous == null) {
      throw new SpawnException(SpawnFailure.NOT_ATTACHED, "session " + session.id() + " was never spawned");
    }
    attachments.remove(session.id());
    previous.controller.close();
    try {
      start(session.id(), previous.config);
    } catch (SpawnException e) {
      // keep the parameters for a later attempt
      attachments.putIfAbsent(session.id(), previous);
      throw e;
    }
  }

  @Override
  public void write(Session session, byte[] data) throws SpawnException {
    Validate.notNull(session, "session must not be null");
    Validate.notNull(data, "data must not be null");
    Attachment attachment = attachments.get(session.id());
    if (attachment == null || !attachment.controller.isAlive()) {
      throw new SpawnException(SpawnFailure.NOT_ATTACHED, "session " + session.id() + " has no running process");
    }
    try {
      OutputStream out = attachment.controller.getPtyInput();
      out.write(data);
      out.flush();
    } catch (IOException e) {
      throw new SpawnException(SpawnFailure.IO_CONTROL_ERROR, "write to session " + session.id() + " failed", e);
    }
  }

  @Override
  public void release(Session session) {
    Validate.notNull(session, "session must not be null");
    Attachment attachment = attachments.remove(session.id());
    if (attachment != null) {
      attachment.controller.close();
      LOGGER.debug("Released process of session {}", session.id());
    }
  }

  /**
   * @param sessionId session id
   * @return true if a live process is attached to the session
   */
  public boolean isRunning(long sessionId) {
    Attachment attachment = attachments.get(sessionId);
    return attachment != null && attachment.controller.isAlive();
  }

  private void start(long sessionId, PtyProcessConfig config) throws SpawnException {
    PtyProcessController controller;
    try {
      controller = launcher.launch(config);
    } catch (IOException e) {
      throw new SpawnException(SpawnFailure.FORK_ERROR, "cannot start " + config.command() + ": " + e.getMessage(), e);
    }
    Attachment attachment = new Attachment(config, controller);

    Thread reader = new Thread(() -> pump(sessionId, controller.getPtyOutput()), "PtyReader-" + sessionId);
    reader.setDaemon(true);
    try {
      reader.start();
    } catch (OutOfMemoryError | IllegalThreadStateException e) {
      controller.close();
      throw new SpawnException(SpawnFailure.THREAD_ERROR, "cannot start reader for session " + sessionId, e);
    }

    attachments.put(sessionId, attachment);
    controller.onExit().whenComplete((code, failure) -> {
      // A respawned or released process must not report for the session.
      if (attachments.get(sessionId) != attachment) {
        return;
      }
      int exitCode = failure != null ? -1 : code;
      marshaller.post(MarshalledRequest.processExited(sessionId, exitCode));
    });
    LOGGER.info("Session {} running {} (PID {})", sessionId, config.command(), controller.pid());
  }

  private void pump(long sessionId, InputStream in) {
    byte[] buffer = new byte[READ_BUFFER_SIZE];
    try {
      int n;
      while ((n = in.read(buffer)) >= 0) {
        if (n > 0 && !marshaller.post(MarshalledRequest.dataArrived(sessionId, buffer, 0, n))) {
          return;
        }
      }
    } catch (IOException e) {
      // The PTY reports an I/O error once the process side closes.
      LOGGER.debug("Reader for session {} stopped: {}", sessionId, e.getMessage());
    }
  }

  private static Map<String, String> defaultEnvironment() {
    Map<String, String> env = new LinkedHashMap<>(System.getenv());
    env.put("TERM", "xterm-256color");
    return env;
  }
}
