package org.digitalresearch.calmlake;

import java.util.ArrayDeque;
import java.util.Deque;

import org.digitalresearch.calmlake.controller.Controller;
import org.digitalresearch.calmlake.controller.ControllerEvents;
import org.digitalresearch.calmlake.controller.ProxyController;
import org.digitalresearch.calmlake.event.EventBroker;
import org.digitalresearch.calmlake.event.EventHandler;
import org.digitalresearch.calmlake.event.EventKind;
import org.digitalresearch.calmlake.stream.StreamProxyFactory;
import org.slf4j.*;

/**
 * A buffer in front of a stream proxy that may break at any time. A CalmLake
 * does two things:
 * <ol>
 * <li>It lets a Controller manage the stream proxy, including replacing it
 * when it is broken.</li>
 * <li>It keeps items that cannot be sent right now in a bounded buffer and
 * sends them, in order, as soon as the controller is ready again.</li>
 * </ol>
 * The first accepted item triggers the connection, so nothing is connected
 * until there is something to send. Data and errors from the controller are
 * passed on to the subscribers of dataEvent and LakeEvents.
 * <p/>
 * A lake is not thread-safe. It, its controller and the controller's proxies
 * must be driven from one execution context, an event loop for example.
 * <p/>
 * Producer -> CalmLake -> Controller -> StreamProxy -> [...]
 *
 * @param <T> The type of items sent.
 * @param <R> The type of data received.
 * @author calm-lake developers
 */
public class CalmLake<T, R> {

  // Log.

  protected static final Logger LOG = LoggerFactory.getLogger(CalmLake.class);

  // Instance fields.

  protected final Controller<T, R> controller;
  protected final CalmLakeOptions options;
  protected final EventBroker broker = new EventBroker();
  protected final EventKind<R> dataEvent = EventKind.<R>named("data");

  // Items that could not be sent yet, oldest first.
  protected final Deque<T> buffer = new ArrayDeque<T>();

  // False after destroy, for good.
  protected boolean running = true;

  // Flips on the first accepted item.
  protected boolean lazilyConnected;

  protected boolean flushing;
  protected boolean flushRequested;

  // Bumped whenever the buffer is dropped.
  protected long bufferEpoch;

  // Implementation.

  public CalmLake(StreamProxyFactory<T, R> proxyFactory) {
    this(proxyFactory, null);
  }

  public CalmLake(StreamProxyFactory<T, R> proxyFactory, CalmLakeOptions options) {
    this(new ProxyController<T, R>(proxyFactory,
        CalmLakeOptions.defaults().merge(options).getMaxConsecutiveFailures()), options);
  }

  /**
   * Create a lake on top of a ready-made controller. The lake subscribes to
   * the controller and owns it from now on.
   *
   * @param controller The controller, used for the whole life of the lake.
   * @param options    Options, null for the defaults.
   */
  public CalmLake(Controller<T, R> controller, CalmLakeOptions options) {
    if (controller == null) throw new NullPointerException("controller");
    this.controller = controller;
    this.options = CalmLakeOptions.defaults().merge(options);
    controller
        .on(controller.dataEvent(), new EventHandler<R>() {
          @Override
          public void handle(R data) {
            broker.publish(dataEvent, data);
          }
        })
        .on(ControllerEvents.error(), new EventHandler<Throwable>() {
          @Override
          public void handle(Throwable error) {
            broker.publish(LakeEvents.error(), error);
          }
        })
        .on(ControllerEvents.ready(), new EventHandler<Void>() {
          @Override
          public void handle(Void ignored) {
            onReady();
          }
        });
  }

  public static <T, R> CalmLake<T, R> calm(StreamProxyFactory<T, R> proxyFactory) {
    return new CalmLake<T, R>(proxyFactory);
  }

  public static <T, R> CalmLake<T, R> calm(StreamProxyFactory<T, R> proxyFactory, CalmLakeOptions options) {
    return new CalmLake<T, R>(proxyFactory, options);
  }

  /**
   * @return The kind of notification carrying data received from the
   *         transport, specific to this lake.
   */
  public EventKind<R> dataEvent() {
    return dataEvent;
  }

  /**
   * Subscribe to dataEvent or to one of the kinds in LakeEvents.
   *
   * @return This lake, for chaining.
   */
  public <P> CalmLake<T, R> on(EventKind<P> kind, EventHandler<? super P> handler) {
    broker.subscribe(kind, handler);
    return this;
  }

  /**
   * Send an item now if the controller takes it, or keep it in the buffer
   * and send it later.
   *
   * @param item The item to send, not null.
   * @return True if the item was accepted, false if this lake is destroyed.
   * @throws BufferOverflowException If the buffer is full. The item is not kept.
   */
  public boolean send(T item) {
    if (!running) return false;
    if (item == null) throw new NullPointerException("item");
    if (buffer.size() >= options.getMaxBufferSize()) {
      throw new BufferOverflowException(options.getMaxBufferSize());
    }
    buffer.addLast(item);

    // Connect on first demand.
    if (!lazilyConnected) {
      LOG.debug("Try to connect lazily");
      lazilyConnected = true;
      flush();
    }
    // Otherwise a controller that is not ready will call onReady later.
    else if (controller.isReady()) {
      flush();
    }
    return true;
  }

  /**
   * Drop everything in the buffer and make the controller go to the next
   * stream proxy. Does nothing after destroy.
   */
  public void reset() {
    if (!running) return;
    LOG.debug("Reset, dropping {} buffered item(s)", buffer.size());
    dropBuffer();
    controller.goNextProxy();
  }

  /**
   * Stop for good: drop the buffer and destroy the controller. Every
   * operation is rejected afterwards.
   */
  public void destroy() {
    if (!running) return;
    running = false;
    LOG.debug("Destroy, dropping {} buffered item(s)", buffer.size());
    dropBuffer();
    controller.destroy();
  }

  public boolean isEmpty() {
    return buffer.isEmpty();
  }

  public int size() {
    return buffer.size();
  }

  public boolean isRunning() {
    return running;
  }

  public CalmLakeOptions getOptions() {
    return options;
  }

  protected void dropBuffer() {
    buffer.clear();
    bufferEpoch++;
  }

  /**
   * Send as many buffered items as the controller takes, oldest first, and
   * stop at the first one it rejects. The rest waits for the next onReady.
   * A flush requested while one is running, which happens when the
   * controller gets ready from within its own send, is done by the running
   * one once its current pass ends.
   *
   * @return False if this lake is destroyed.
   */
  boolean flush() {
    if (!running) {
      LOG.debug("Cannot flush because the lake is destroyed");
      return false;
    }
    if (flushing) {
      flushRequested = true;
      return true;
    }
    flushing = true;
    try {
      do {
        flushRequested = false;
        drain();
      } while (flushRequested && running);
    } finally {
      flushing = false;
    }
    return true;
  }

  protected void drain() {
    while (running && !buffer.isEmpty()) {
      T oldest = buffer.peekFirst();
      long epoch = bufferEpoch;
      if (!controller.send(oldest)) {
        LOG.debug("Controller rejected an item, {} item(s) wait for it", buffer.size());
        return;
      }

      // A reset from within the send already dropped the item.
      if (epoch == bufferEpoch) buffer.pollFirst();
    }
  }

  /**
   * Called by the controller when a stream proxy got connected, for the
   * first time or after a failure.
   *
   * @return False if this lake is destroyed.
   */
  boolean onReady() {
    if (!running) {
      LOG.debug("Cannot be ready because the lake is destroyed");
      return false;
    }
    LOG.debug("Controller is ready, flushing {} buffered item(s)", buffer.size());
    return flush();
  }
}
