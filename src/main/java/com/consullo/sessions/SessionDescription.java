package com.consullo.sessions;

import java.nio.file.Path;
import java.util.List;

/**
 * Saved description of a session that can be started again.
 *
 * @param commandLine argument vector
 * @param workingDirectory working directory, or null
 * @param title window title, or null
 * @since 1.0
 */
public record SessionDescription(List<String> commandLine, Path workingDirectory, String title) {

  public SessionDescription {
    if (commandLine == null || commandLine.isEmpty()) {
      throw new IllegalArgumentException("commandLine must not be empty.");
    }
    commandLine = List.copyOf(commandLine);
  }
}
