package com.consullo.sessions.marshal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe FIFO carrying {@link MarshalledRequest}s from background threads
 * to the coordinating thread.
 *
 * <p>
 * {@link #post} may be called from any thread and never blocks. The drain
 * methods are called by the coordinating thread only, which applies each
 * request in the order it was posted.
 * </p>
 *
 * @since 1.0
 */
public final class RequestMarshaller {

  private static final Logger LOGGER = LoggerFactory.getLogger(RequestMarshaller.class);

  private final BlockingQueue<MarshalledRequest> queue = new LinkedBlockingQueue<>();
  private volatile boolean accepting = true;

  /**
   * Enqueues a request.
   *
   * @param request request
   * @return false if the marshaller has been shut down and the request was dropped
   */
  public boolean post(MarshalledRequest request) {
    Validate.notNull(request, "request must not be null");
    if (!accepting) {
      LOGGER.debug("Dropping {} posted after shutdown", request);
      return false;
    }
    queue.add(request);
    return true;
  }

  /**
   * Applies every request queued at this moment, without waiting.
   *
   * @param applier applies one request
   * @return number of requests applied
   */
  public int drain(Consumer<MarshalledRequest> applier) {
    Validate.notNull(applier, "applier must not be null");
    List<MarshalledRequest> batch = new ArrayList<>();
    queue.drainTo(batch);
    for (MarshalledRequest request : batch) {
      applier.accept(request);
    }
    return batch.size();
  }

  /**
   * Waits up to the timeout for a request, then applies it and everything queued behind it.
   *
   * @param timeout maximum wait
   * @param unit timeout unit
   * @param applier applies one request
   * @return number of requests applied
   * @throws InterruptedException if interrupted while waiting
   */
  public int awaitAndDrain(long timeout, TimeUnit unit, Consumer<MarshalledRequest> applier) throws InterruptedException {
    Validate.notNull(applier, "applier must not be null");
    MarshalledRequest first = queue.poll(timeout, unit);
    if (first == null) {
      return 0;
    }
    applier.accept(first);
    return 1 + drain(applier);
  }

  public int pendingCount() {
    return queue.size();
  }

  public boolean isAccepting() {
    return accepting;
  }

  /**
   * Stops accepting requests and discards the ones still queued.
   *
   * @return number of discarded requests
   */
  public int shutdown() {
    accepting = false;
    List<MarshalledRequest> discarded = new ArrayList<>();
    queue.drainTo(discarded);
    if (!discarded.isEmpty()) {
      LOGGER.info("Discarded {} pending requests at shutdown", discarded.size());
    }
    return discarded.size();
  }
}
