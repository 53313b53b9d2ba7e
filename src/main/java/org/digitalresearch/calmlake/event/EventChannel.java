package org.digitalresearch.calmlake.event;

/**
 * A publish/subscribe registry keyed by the kind of notification. Any number
 * of handlers can subscribe to a kind, and they are called in the order in
 * which they subscribed.
 * <p/>
 * Publisher -> EventChannel -> [handler, handler, ...]
 *
 * @author calm-lake developers
 */
public interface EventChannel {

  // Interface.

  /**
   * Register a handler for a kind of notification. Subscribing the same
   * handler twice means it is called twice.
   *
   * @param kind    The kind of notification.
   * @param handler The handler to call on every publish of that kind.
   */
  <P> void subscribe(EventKind<P> kind, EventHandler<? super P> handler);

  /**
   * Remove one registration of a handler.
   *
   * @param kind    The kind of notification.
   * @param handler The handler to remove.
   * @return Whether the handler was registered for that kind.
   */
  <P> boolean unsubscribe(EventKind<P> kind, EventHandler<? super P> handler);

  /**
   * Deliver a payload to every handler subscribed to the kind.
   *
   * @param kind    The kind of notification.
   * @param payload The payload.
   */
  <P> void publish(EventKind<P> kind, P payload);
}
