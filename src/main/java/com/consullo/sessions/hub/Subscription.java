package com.consullo.sessions.hub;

/**
 * Handle returned by {@link NotificationHub#subscribe}. Cancelling is idempotent.
 *
 * @param <K> event kind type
 * @since 1.0
 */
public final class Subscription<K> {

  private final NotificationHub<K> hub;
  private final K kind;
  private final NotificationListener<K> listener;

  Subscription(NotificationHub<K> hub, K kind, NotificationListener<K> listener) {
    this.hub = hub;
    this.kind = kind;
    this.listener = listener;
  }

  public K kind() {
    return kind;
  }

  NotificationListener<K> listener() {
    return listener;
  }

  /**
   * Same as {@code hub.unsubscribe(this)}.
   */
  public void cancel() {
    hub.unsubscribe(this);
  }
}
