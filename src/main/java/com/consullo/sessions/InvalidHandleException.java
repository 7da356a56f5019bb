package com.consullo.sessions;

/**
 * Thrown when an operation names a session, window or workspace that the
 * coordinator does not track.
 *
 * @since 1.0
 */
public class InvalidHandleException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidHandleException(String message) {
    super(message);
  }
}
