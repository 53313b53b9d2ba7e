package org.digitalresearch.calmlake.controller;

import org.digitalresearch.calmlake.event.EventHandler;
import org.digitalresearch.calmlake.event.EventKind;

/**
 * A Controller owns exactly one active stream proxy at a time and hides its
 * failures and replacements from the CalmLake using it. It decides when to
 * connect, when to give up on a proxy and how to get a new one; the lake only
 * asks whether it is ready, hands it items one at a time and listens to the
 * notifications in ControllerEvents and to dataEvent.
 * <p/>
 * CalmLake -> Controller -> StreamProxy -> [...]
 *
 * @param <T> The type of items sent.
 * @param <R> The type of data received.
 * @author calm-lake developers
 */
public interface Controller<T, R> {

  // Interface.

  /**
   * @return Whether a send would currently be accepted.
   */
  boolean isReady();

  /**
   * Hand one item to the current stream proxy. Must not block.
   *
   * @param item The item to send.
   * @return True if the item was accepted for transmission.
   */
  boolean send(T item);

  /**
   * Abandon the current stream proxy and start establishing a new one.
   */
  void goNextProxy();

  /**
   * Close the current stream proxy for good. Nothing is sent or published
   * afterwards.
   */
  void destroy();

  /**
   * @return The kind of notification carrying data received from the
   *         current stream proxy. Each controller has its own.
   */
  EventKind<R> dataEvent();

  /**
   * Subscribe to dataEvent or to one of the kinds in ControllerEvents.
   *
   * @return This controller, for chaining.
   */
  <P> Controller<T, R> on(EventKind<P> kind, EventHandler<? super P> handler);
}
