package com.consullo.sessions.session;

import com.consullo.sessions.window.TerminalWindow;
import java.nio.file.Path;
import java.util.List;

/**
 * One interactive process bound to a terminal window.
 *
 * <p>
 * Instances are created by {@link SessionRegistry#newSession} and only mutated
 * by the registry, on the coordinating thread. Other code reads them.
 * </p>
 *
 * @since 1.0
 */
public final class Session {

  private final long id;
  private final List<String> commandLine;
  private final Path workingDirectory;

  private SessionState state = SessionState.BRAND_NEW;
  private TerminalWindow window;
  private String title = "";
  private Integer exitCode;

  Session(long id, List<String> commandLine, Path workingDirectory) {
    this.id = id;
    this.commandLine = List.copyOf(commandLine);
    this.workingDirectory = workingDirectory;
  }

  public long id() {
    return id;
  }

  public List<String> commandLine() {
    return commandLine;
  }

  public Path workingDirectory() {
    return workingDirectory;
  }

  public SessionState state() {
    return state;
  }

  /**
   * Returns the bound window, or null before the session is tracked.
   *
   * @return window or null
   */
  public TerminalWindow window() {
    return window;
  }

  public String title() {
    return title;
  }

  /**
   * Returns the exit code of the last process run, or null if it has not exited.
   *
   * @return exit code or null
   */
  public Integer exitCode() {
    return exitCode;
  }

  /**
   * Location string used as a title when nothing better is known: the command line.
   *
   * @return resource location
   */
  public String resourceLocation() {
    return String.join(" ", commandLine);
  }

  void setState(SessionState state) {
    this.state = state;
  }

  void setWindow(TerminalWindow window) {
    this.window = window;
  }

  void setTitle(String title) {
    this.title = title;
  }

  void setExitCode(Integer exitCode) {
    this.exitCode = exitCode;
  }

  @Override
  public String toString() {
    return "Session#" + id + "[" + state + ", \"" + title + "\"]";
  }
}
