package com.consullo.sessions.hub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the keyed publish/subscribe hub.
 *
 * @since 1.0
 */
public class NotificationHubTest {

  private enum Kind {
    A, B
  }

  private final NotificationHub<Kind> hub = new NotificationHub<>();
  private final List<String> calls = new ArrayList<>();

  @Test
  @DisplayName("Should call listeners of the published kind in registration order")
  void publish_SeveralListeners_CallsInRegistrationOrder() {
    hub.subscribe(Kind.A, (kind, context) -> calls.add("first:" + context));
    hub.subscribe(Kind.A, (kind, context) -> calls.add("second:" + context));
    hub.subscribe(Kind.B, (kind, context) -> calls.add("other:" + context));

    hub.publish(Kind.A, "x");

    assertThat(calls).containsExactly("first:x", "second:x");
  }

  @Test
  @DisplayName("Should do nothing when a kind has no listeners")
  void publish_NoListeners_IsNoOp() {
    hub.publish(Kind.B, null);

    assertThat(hub.subscriberCount(Kind.B)).isZero();
  }

  @Test
  @DisplayName("Should return the existing handle when the same listener subscribes twice")
  void subscribe_SameListenerTwice_RegistersOnce() {
    NotificationListener<Kind> listener = (kind, context) -> calls.add("called");

    Subscription<Kind> first = hub.subscribe(Kind.A, listener);
    Subscription<Kind> second = hub.subscribe(Kind.A, listener);
    hub.publish(Kind.A, null);

    assertThat(second).isSameAs(first);
    assertThat(calls).containsExactly("called");
  }

  @Test
  @DisplayName("Should ignore repeated and unknown unsubscribes")
  void unsubscribe_Repeated_IsIdempotent() {
    Subscription<Kind> subscription = hub.subscribe(Kind.A, (kind, context) -> calls.add("called"));

    hub.unsubscribe(subscription);
    hub.unsubscribe(subscription);
    subscription.cancel();
    hub.unsubscribe(null);
    hub.publish(Kind.A, null);

    assertThat(calls).isEmpty();
    assertThat(hub.subscriberCount(Kind.A)).isZero();
  }

  @Test
  @DisplayName("Should not call a listener added during a publish until the next publish")
  void publish_ListenerSubscribesAnother_NewListenerWaitsForNextPublish() {
    hub.subscribe(Kind.A, (kind, context) -> {
      calls.add("outer");
      hub.subscribe(Kind.A, (k, c) -> calls.add("inner"));
    });

    hub.publish(Kind.A, null);
    assertThat(calls).containsExactly("outer");

    hub.publish(Kind.A, null);
    assertThat(calls).containsExactly("outer", "outer", "inner");
  }

  @Test
  @DisplayName("Should still call a listener removed by an earlier listener in the same publish")
  void publish_ListenerRemovesLaterOne_SnapshotStillDelivers() {
    AtomicReference<Subscription<Kind>> later = new AtomicReference<>();
    hub.subscribe(Kind.A, (kind, context) -> {
      calls.add("remover");
      later.get().cancel();
    });
    later.set(hub.subscribe(Kind.A, (kind, context) -> calls.add("removed")));

    hub.publish(Kind.A, null);
    hub.publish(Kind.A, null);

    assertThat(calls).containsExactly("remover", "removed", "remover");
  }

  @Test
  @DisplayName("Should keep delivering after a listener throws")
  void publish_ListenerThrows_OthersStillCalled() {
    hub.subscribe(Kind.A, (kind, context) -> {
      throw new IllegalStateException("boom");
    });
    hub.subscribe(Kind.A, (kind, context) -> calls.add("after"));

    hub.publish(Kind.A, null);

    assertThat(calls).containsExactly("after");
  }
}
