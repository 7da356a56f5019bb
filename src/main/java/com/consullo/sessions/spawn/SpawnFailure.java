package com.consullo.sessions.spawn;

/**
 * Reasons a process could not be started or reached.
 *
 * @since 1.0
 */
public enum SpawnFailure {
  /** Invalid input, such as an empty command line or a missing working directory. */
  PARAMETER_ERROR,
  /** The operating system refused to start the process. */
  FORK_ERROR,
  /** A reader or monitor thread could not be started. */
  THREAD_ERROR,
  /** Reading from or writing to the pseudo-terminal failed. */
  IO_CONTROL_ERROR,
  /** The session has no process attached. */
  NOT_ATTACHED
}
