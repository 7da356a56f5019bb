package com.consullo.sessions.hub;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed publish/subscribe registry.
 *
 * <p>
 * Listeners for a kind are invoked in registration order, synchronously, on
 * the thread that calls {@link #publish}. Each publish iterates over a copy of
 * the listener list taken when it starts, so listeners may subscribe or
 * unsubscribe (themselves or others) from inside a callback. A listener added
 * during a publish is first called on the next publish; a listener removed
 * during a publish is still called by the publish already in progress.
 * </p>
 *
 * <p>
 * The hub is not thread-safe. It is owned by the coordinating thread along with
 * the registries that publish through it.
 * </p>
 *
 * @param <K> event kind type
 * @since 1.0
 */
public final class NotificationHub<K> {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationHub.class);

  private final Map<K, List<Subscription<K>>> subscriptionsByKind = new LinkedHashMap<>();

  /**
   * Registers a listener for one kind of event.
   *
   * <p>
   * Registering the same listener instance twice for the same kind returns the
   * existing subscription; the listener is still called once per publish.
   * </p>
   *
   * @param kind event kind
   * @param listener callback
   * @return subscription handle
   */
  public Subscription<K> subscribe(K kind, NotificationListener<K> listener) {
    Validate.notNull(kind, "kind must not be null");
    Validate.notNull(listener, "listener must not be null");

    List<Subscription<K>> subscriptions = subscriptionsByKind.computeIfAbsent(kind, k -> new ArrayList<>());
    for (Subscription<K> existing : subscriptions) {
      if (existing.listener() == listener) {
        return existing;
      }
    }
    Subscription<K> subscription = new Subscription<>(this, kind, listener);
    subscriptions.add(subscription);
    return subscription;
  }

  /**
   * Removes a subscription. Unknown or already-removed handles are ignored.
   *
   * @param subscription handle returned by {@link #subscribe}
   */
  public void unsubscribe(Subscription<K> subscription) {
    if (subscription == null) {
      return;
    }
    List<Subscription<K>> subscriptions = subscriptionsByKind.get(subscription.kind());
    if (subscriptions == null) {
      return;
    }
    subscriptions.remove(subscription);
    if (subscriptions.isEmpty()) {
      subscriptionsByKind.remove(subscription.kind());
    }
  }

  /**
   * Invokes every listener currently registered for the kind.
   *
   * <p>
   * A listener that throws is logged and skipped; delivery continues with the
   * remaining listeners.
   * </p>
   *
   * @param kind event kind
   * @param context event-specific context (may be null)
   */
  public void publish(K kind, Object context) {
    Validate.notNull(kind, "kind must not be null");

    List<Subscription<K>> subscriptions = subscriptionsByKind.get(kind);
    if (subscriptions == null || subscriptions.isEmpty()) {
      return;
    }
    List<Subscription<K>> copy = new ArrayList<>(subscriptions);
    for (Subscription<K> subscription : copy) {
      try {
        subscription.listener().onNotification(kind, context);
      } catch (RuntimeException e) {
        LOGGER.warn("Listener for {} failed: {}", kind, e.getMessage(), e);
      }
    }
  }

  /**
   * Returns the number of listeners registered for a kind.
   *
   * @param kind event kind
   * @return listener count
   */
  public int subscriberCount(K kind) {
    List<Subscription<K>> subscriptions = subscriptionsByKind.get(kind);
    return subscriptions == null ? 0 : subscriptions.size();
  }

  /**
   * Drops every subscription.
   */
  public void clear() {
    subscriptionsByKind.clear();
  }
}
