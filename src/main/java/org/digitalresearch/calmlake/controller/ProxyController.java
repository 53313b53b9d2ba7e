package org.digitalresearch.calmlake.controller;

import org.digitalresearch.calmlake.event.EventBroker;
import org.digitalresearch.calmlake.event.EventHandler;
import org.digitalresearch.calmlake.event.EventKind;
import org.digitalresearch.calmlake.stream.StreamProxy;
import org.digitalresearch.calmlake.stream.StreamProxyFactory;
import org.digitalresearch.calmlake.stream.StreamProxyListener;
import org.slf4j.*;

/**
 * The default Controller. It creates stream proxies from a factory, lazily on
 * the first send, and replaces the current proxy whenever it reports an error
 * or closes without being asked to. Every proxy gets a generation number;
 * events from a proxy of an older generation are ignored, so a replaced proxy
 * cannot make the controller ready or publish its leftovers.
 * <p/>
 * Rotation stops after maxConsecutiveFailures failures without a successful
 * connect in between. Once a proxy has been asked for, a controller left
 * without one (after giving up, or after the factory failed) opens a new one
 * on the next isReady, send or goNextProxy, so that a lake polling readiness
 * gets its buffer moving again.
 *
 * @param <T> The type of items sent.
 * @param <R> The type of data received.
 * @author calm-lake developers
 */
public class ProxyController<T, R> implements Controller<T, R> {

  // Log.

  protected static final Logger LOG = LoggerFactory.getLogger(ProxyController.class);

  // Constants.

  public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 16;

  // Instance fields.

  protected final StreamProxyFactory<T, R> factory;
  protected final int maxConsecutiveFailures;
  protected final EventBroker broker = new EventBroker();
  protected final EventKind<R> dataEvent = EventKind.<R>named("data");

  protected StreamProxy<T, R> proxy;
  protected long generation;
  protected int consecutiveFailures;
  protected boolean ready;
  protected boolean destroyed;

  // Set by the first send or goNextProxy; no proxy is opened before that.
  protected boolean demanded;

  // Implementation.

  public ProxyController(StreamProxyFactory<T, R> factory) {
    this(factory, DEFAULT_MAX_CONSECUTIVE_FAILURES);
  }

  public ProxyController(StreamProxyFactory<T, R> factory, int maxConsecutiveFailures) {
    if (factory == null) throw new NullPointerException("factory");
    if (maxConsecutiveFailures < 0) throw new IllegalArgumentException(
        "maxConsecutiveFailures must not be negative: " + maxConsecutiveFailures);
    this.factory = factory;
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  /**
   * @return Whether a proxy currently exists, connected or not.
   */
  public boolean hasProxy() {
    return proxy != null;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  protected void openProxy() {
    demanded = true;
    long myGeneration = ++generation;
    ready = false;
    StreamProxy<T, R> next;
    try {
      next = factory.create();
    } catch (RuntimeException e) {
      LOG.warn("Failed to create a stream proxy", e);
      broker.publish(ControllerEvents.error(), e);
      return;
    }
    proxy = next;
    LOG.debug("Connecting stream proxy #{}", myGeneration);
    next.connect(new GenerationListener(myGeneration));
  }

  protected void closeProxy() {
    StreamProxy<T, R> old = proxy;
    proxy = null;
    ready = false;

    // Bump the generation first so that the close event of the old proxy is stale.
    generation++;
    if (old != null) old.close();
  }

  protected void failed() {
    ready = false;
    consecutiveFailures++;
    if (consecutiveFailures > maxConsecutiveFailures) {
      LOG.warn("Giving up after {} consecutive failures, waiting for the next request",
          consecutiveFailures);
      closeProxy();
      return;
    }
    LOG.info("Stream proxy failed, rotating to a new one (failure {} of {})",
        consecutiveFailures, maxConsecutiveFailures);
    closeProxy();
    openProxy();
  }

  // Controller implementation.

  @Override
  public boolean isReady() {
    if (destroyed) return false;
    if (proxy == null && demanded) openProxy();
    return ready;
  }

  @Override
  public boolean send(T item) {
    if (destroyed) return false;
    if (proxy == null) openProxy();
    if (!ready || proxy == null) return false;
    return proxy.send(item);
  }

  @Override
  public void goNextProxy() {
    if (destroyed) return;
    LOG.info("Going to the next stream proxy");
    consecutiveFailures = 0;
    closeProxy();
    openProxy();
  }

  @Override
  public void destroy() {
    if (destroyed) return;
    destroyed = true;
    LOG.debug("Destroying controller");
    closeProxy();
  }

  @Override
  public EventKind<R> dataEvent() {
    return dataEvent;
  }

  @Override
  public <P> Controller<T, R> on(EventKind<P> kind, EventHandler<? super P> handler) {
    broker.subscribe(kind, handler);
    return this;
  }

  // Inner classes.

  protected class GenerationListener implements StreamProxyListener<R> {

    // Instance fields.

    protected final long myGeneration;

    // Implementation.

    public GenerationListener(long myGeneration) {
      this.myGeneration = myGeneration;
    }

    protected boolean stale() {
      return destroyed || generation != myGeneration;
    }

    // StreamProxyListener implementation.

    @Override
    public void onConnected() {
      if (stale()) return;
      LOG.debug("Stream proxy #{} connected", myGeneration);
      ready = true;
      consecutiveFailures = 0;
      broker.publish(ControllerEvents.ready(), null);
    }

    @Override
    public void onData(R data) {
      if (stale()) return;
      broker.publish(dataEvent, data);
    }

    @Override
    public void onError(Throwable cause) {
      if (stale()) return;
      LOG.warn("Stream proxy #{} reported an error", myGeneration, cause);
      ready = false;
      broker.publish(ControllerEvents.error(), cause);

      // A handler may have rotated or destroyed us already.
      if (stale()) return;
      failed();
    }

    @Override
    public void onClosed() {
      if (stale()) return;
      LOG.info("Stream proxy #{} closed unexpectedly", myGeneration);
      failed();
    }
  }
}
