package com.consullo.sessions.config;

/**
 * Read-only preference lookup. Values are read each time they are needed, so
 * implementations may change them at runtime.
 *
 * @since 1.0
 */
public interface PreferenceStore {

  /**
   * Consulted when a session's process exits.
   *
   * @return true to keep the session (and its window) around in the dead state for a respawn
   */
  boolean keepWindowOpenOnExit();

  /**
   * Consulted when a new window is displayed.
   *
   * @return true to add new windows as tabs of the active workspace
   */
  boolean useTabs();
}
