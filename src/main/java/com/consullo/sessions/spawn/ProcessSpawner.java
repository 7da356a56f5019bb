package com.consullo.sessions.spawn;

import com.consullo.sessions.session.Session;
import com.consullo.sessions.window.TerminalWindow;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts and stops the processes behind sessions.
 *
 * <p>
 * Methods are called on the coordinating thread. Implementations report
 * process output and termination back through the request marshaller, never
 * by touching the session directly.
 * </p>
 *
 * @since 1.0
 */
public interface ProcessSpawner {

  /**
   * Starts a process for a session.
   *
   * @param session session the process belongs to
   * @param window window whose screen receives the output
   * @param commandLine argument vector
   * @param workingDirectory working directory
   * @throws SpawnException if the process cannot be started
   */
  void spawn(Session session, TerminalWindow window, List<String> commandLine, Path workingDirectory)
          throws SpawnException;

  /**
   * Starts the session's process again with the parameters of the last spawn.
   *
   * @param session session previously passed to {@link #spawn}
   * @throws SpawnException if the process cannot be started or the session was never spawned
   */
  void respawn(Session session) throws SpawnException;

  /**
   * Sends input bytes to the session's process.
   *
   * @param session session
   * @param data bytes to write
   * @throws SpawnException if no process is attached or the write fails
   */
  void write(Session session, byte[] data) throws SpawnException;

  /**
   * Terminates the session's process, if any, and forgets the session. Safe to call more than once.
   *
   * @param session session
   */
  void release(Session session);
}
