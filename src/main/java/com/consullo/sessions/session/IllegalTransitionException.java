package com.consullo.sessions.session;

/**
 * Thrown when a session is asked to move to a state its current state cannot reach.
 *
 * @since 1.0
 */
public class IllegalTransitionException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  private final SessionState from;
  private final SessionState to;

  public IllegalTransitionException(long sessionId, SessionState from, SessionState to) {
    super("Session " + sessionId + " cannot move from " + from + " to " + to);
    this.from = from;
    this.to = to;
  }

  public SessionState from() {
    return from;
  }

  public SessionState to() {
    return to;
  }
}
