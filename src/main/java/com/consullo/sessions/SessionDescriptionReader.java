package com.consullo.sessions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses a saved session file. The file format belongs to the implementation.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface SessionDescriptionReader {

  /**
   * @param file file to read
   * @return description of the session to start
   * @throws IOException if the file cannot be read or parsed
   */
  SessionDescription read(Path file) throws IOException;
}
