package com.consullo.sessions.spawn;

/**
 * Raised by a {@link ProcessSpawner} when a process cannot be started or reached.
 *
 * @since 1.0
 */
public class SpawnException extends Exception {

  private static final long serialVersionUID = 1L;

  private final SpawnFailure failure;

  public SpawnException(SpawnFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public SpawnException(SpawnFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public SpawnFailure failure() {
    return failure;
  }
}
