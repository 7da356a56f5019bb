package com.consullo.sessions.session;

/**
 * Lifecycle states of a session, in the only order they may be entered.
 *
 * <p>
 * Regular transitions only move forward, although intermediate states may be
 * skipped. The one exception is a respawn, which takes a {@link #DEAD} session
 * back to {@link #ACTIVE_UNSTABLE}; see {@link SessionRegistry#respawn}.
 * </p>
 *
 * @since 1.0
 */
public enum SessionState {
  BRAND_NEW,
  INITIALIZED,
  ACTIVE_UNSTABLE,
  ACTIVE_STABLE,
  DEAD,
  IMMINENT_DISPOSAL;

  /**
   * Returns true while the backing process is believed to be running.
   *
   * @return true for the two active states
   */
  public boolean isActive() {
    return this == ACTIVE_UNSTABLE || this == ACTIVE_STABLE;
  }

  /**
   * Checks whether a regular transition from this state to {@code next} is legal.
   *
   * <p>
   * Respawn is not a regular transition and is not covered here.
   * </p>
   *
   * @param next proposed state
   * @return true if legal
   */
  public boolean canTransitionTo(SessionState next) {
    if (next == null || next.ordinal() <= ordinal()) {
      return false;
    }
    if (next == IMMINENT_DISPOSAL) {
      return this == DEAD;
    }
    return true;
  }
}
