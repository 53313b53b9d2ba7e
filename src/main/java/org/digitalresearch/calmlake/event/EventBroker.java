package org.digitalresearch.calmlake.event;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.*;

/**
 * The default EventChannel. Not thread-safe: like the components that own
 * one, a broker is meant to be used from a single execution context.
 * <p/>
 * Delivery works on a snapshot of the handlers, so a handler may subscribe or
 * unsubscribe while a notification is being delivered without affecting that
 * delivery. A handler that throws does not keep the others from being called.
 *
 * @author calm-lake developers
 */
public class EventBroker implements EventChannel {

  // Log.

  protected static final Logger LOG = LoggerFactory.getLogger(EventBroker.class);

  // Instance fields.

  protected final Map<EventKind<?>, List<EventHandler<?>>> handlersByKind =
      new HashMap<EventKind<?>, List<EventHandler<?>>>();

  // Implementation.

  /**
   * Whether anybody listens to the specified kind.
   *
   * @param kind The kind of notification.
   * @return True if at least one handler is subscribed.
   */
  public boolean hasSubscribers(EventKind<?> kind) {
    List<EventHandler<?>> handlers = handlersByKind.get(kind);
    return handlers != null && !handlers.isEmpty();
  }

  // EventChannel implementation.

  @Override
  public <P> void subscribe(EventKind<P> kind, EventHandler<? super P> handler) {
    if (kind == null) throw new NullPointerException("kind");
    if (handler == null) throw new NullPointerException("handler");
    List<EventHandler<?>> handlers = handlersByKind.get(kind);
    if (handlers == null) {
      handlers = new ArrayList<EventHandler<?>>();
      handlersByKind.put(kind, handlers);
    }
    handlers.add(handler);
  }

  @Override
  public <P> boolean unsubscribe(EventKind<P> kind, EventHandler<? super P> handler) {
    List<EventHandler<?>> handlers = handlersByKind.get(kind);
    if (handlers == null) return false;
    boolean removed = handlers.remove(handler);
    if (handlers.isEmpty()) handlersByKind.remove(kind);
    return removed;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <P> void publish(EventKind<P> kind, P payload) {
    List<EventHandler<?>> handlers = handlersByKind.get(kind);
    if (handlers == null) return;
    for (EventHandler<?> handler : new ArrayList<EventHandler<?>>(handlers)) {
      try {
        ((EventHandler<P>) handler).handle(payload);
      } catch (RuntimeException e) {
        LOG.warn("Handler for '{}' failed", kind, e);
      }
    }
  }
}
