package com.consullo.sessions.marshal;

import com.consullo.sessions.session.SessionState;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RequestMarshaller} and {@link MarshalledRequest}.
 *
 * @since 1.0
 */
public class RequestMarshallerTest {

  @Test
  @DisplayName("Should apply requests in posting order")
  void drain_SeveralRequests_AppliedInOrder() {
    RequestMarshaller marshaller = new RequestMarshaller();
    marshaller.post(MarshalledRequest.stateChange(1, SessionState.ACTIVE_UNSTABLE));
    marshaller.post(MarshalledRequest.processExited(1, 0));
    marshaller.post(MarshalledRequest.stateChange(2, SessionState.DEAD));
    List<MarshalledRequest> applied = new ArrayList<>();

    int count = marshaller.drain(applied::add);

    assertThat(count).isEqualTo(3);
    assertThat(applied).extracting(MarshalledRequest::type).containsExactly(
            MarshalledRequest.Type.STATE_CHANGE,
            MarshalledRequest.Type.PROCESS_EXITED,
            MarshalledRequest.Type.STATE_CHANGE);
    assertThat(marshaller.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should keep each producer's requests in order across threads")
  void post_ConcurrentProducers_PerProducerFifo() throws Exception {
    RequestMarshaller marshaller = new RequestMarshaller();
    int producers = 4;
    int perProducer = 500;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int p = 0; p < producers; p++) {
      long sessionId = p;
      Thread thread = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < perProducer; i++) {
          marshaller.post(MarshalledRequest.processExited(sessionId, i));
        }
      });
      threads.add(thread);
      thread.start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(10_000);
    }

    Map<Long, List<Integer>> bySession = new HashMap<>();
    marshaller.drain(r -> bySession.computeIfAbsent(r.sessionId(), id -> new ArrayList<>()).add(r.exitCode()));

    assertThat(bySession).hasSize(producers);
    for (List<Integer> codes : bySession.values()) {
      assertThat(codes).hasSize(perProducer).isSorted();
    }
  }

  @Test
  @DisplayName("Should drop requests posted after shutdown")
  void post_AfterShutdown_ReturnsFalse() {
    RequestMarshaller marshaller = new RequestMarshaller();
    marshaller.shutdown();

    assertThat(marshaller.post(MarshalledRequest.processExited(1, 0))).isFalse();
    assertThat(marshaller.isAccepting()).isFalse();
    assertThat(marshaller.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should report how many pending requests shutdown discarded")
  void shutdown_PendingRequests_ReturnsDiscardedCount() {
    RequestMarshaller marshaller = new RequestMarshaller();
    marshaller.post(MarshalledRequest.processExited(1, 0));
    marshaller.post(MarshalledRequest.processExited(2, 0));

    assertThat(marshaller.shutdown()).isEqualTo(2);
    assertThat(marshaller.drain(r -> { })).isZero();
  }

  @Test
  @DisplayName("Should return zero when nothing arrives before the timeout")
  void awaitAndDrain_NothingPosted_TimesOut() throws InterruptedException {
    RequestMarshaller marshaller = new RequestMarshaller();

    assertThat(marshaller.awaitAndDrain(10, TimeUnit.MILLISECONDS, r -> { })).isZero();
  }

  @Test
  @DisplayName("Should wake for a request posted by another thread")
  void awaitAndDrain_PostedLater_AppliesIt() throws InterruptedException {
    RequestMarshaller marshaller = new RequestMarshaller();
    Thread producer = new Thread(() -> marshaller.post(MarshalledRequest.processExited(7, 3)));
    producer.start();
    List<MarshalledRequest> applied = new ArrayList<>();

    int count = 0;
    for (int attempt = 0; attempt < 50 && count == 0; attempt++) {
      count = marshaller.awaitAndDrain(100, TimeUnit.MILLISECONDS, applied::add);
    }
    producer.join();

    assertThat(count).isEqualTo(1);
    assertThat(applied.get(0).sessionId()).isEqualTo(7);
    assertThat(applied.get(0).exitCode()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should copy the bytes so later buffer reuse does not leak in")
  void dataArrived_BufferReused_RequestKeepsOriginalBytes() {
    byte[] buffer = "hello world".getBytes(StandardCharsets.UTF_8);
    MarshalledRequest request = MarshalledRequest.dataArrived(1, buffer, 6, 5);
    buffer[6] = 'W';

    assertThat(new String(request.data(), StandardCharsets.UTF_8)).isEqualTo("world");
    request.data()[0] = 'X';
    assertThat(new String(request.data(), StandardCharsets.UTF_8)).isEqualTo("world");
  }

  @Test
  @DisplayName("Should reject an out-of-range slice")
  void dataArrived_BadRange_Throws() {
    assertThatThrownBy(() -> MarshalledRequest.dataArrived(1, new byte[4], 2, 3))
            .isInstanceOf(IllegalArgumentException.class);
  }
}
