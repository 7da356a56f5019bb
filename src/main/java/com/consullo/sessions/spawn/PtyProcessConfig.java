package com.consullo.sessions.spawn;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Parameters for spawning a PTY-attached process. Kept per session so a respawn can reuse them.
 *
 * @param command command and arguments
 * @param workingDirectory working directory for the spawned process
 * @param environment complete environment of the process
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {

  public PtyProcessConfig {
    command = List.copyOf(command);
    environment = Map.copyOf(environment);
  }
}
