package com.consullo.sessions;

/**
 * Event kinds the coordinator publishes through its notification hub.
 *
 * @since 1.0
 */
public enum CoordinatorEvent {

  /** The number of tracked sessions changed. Context: the new count ({@link Integer}). */
  SESSION_COUNT_CHANGED,

  /** A session entered a new lifecycle state. Context: the session. */
  SESSION_STATE_CHANGED,

  /** A session's title changed. Context: the session. */
  SESSION_TITLE_CHANGED,

  /** The session the user is focused on changed. Context: the session. */
  ACTIVE_SESSION_CHANGED,

  /** A window started or stopped being tracked. Context: the window. */
  WINDOW_LIST_CHANGED,

  /** Windows were added to or removed from a workspace. Context: the workspace. */
  WORKSPACE_MEMBERSHIP_CHANGED
}
