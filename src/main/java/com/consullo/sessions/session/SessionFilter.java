package com.consullo.sessions.session;

import java.util.function.Predicate;

/**
 * Common filters for session enumeration.
 *
 * @since 1.0
 */
public enum SessionFilter implements Predicate<Session> {

  /** Every tracked session. */
  ALL {
    @Override
    public boolean test(Session session) {
      return true;
    }
  },

  /** Sessions whose process is running. */
  ACTIVE {
    @Override
    public boolean test(Session session) {
      return session.state().isActive();
    }
  },

  /** Sessions whose process has exited but that are kept for a possible respawn. */
  DEAD {
    @Override
    public boolean test(Session session) {
      return session.state() == SessionState.DEAD;
    }
  }
}
