package com.consullo.sessions.hub;

/**
 * Callback registered with a {@link NotificationHub}.
 *
 * @param <K> event kind type
 * @since 1.0
 */
@FunctionalInterface
public interface NotificationListener<K> {

  /**
   * Called synchronously on the publishing thread.
   *
   * @param kind the event kind that was published
   * @param context event-specific context (may be null)
   */
  void onNotification(K kind, Object context);
}
