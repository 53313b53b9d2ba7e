package org.digitalresearch.calmlake.event;

/**
 * Callback interface used by an EventChannel to deliver notifications.
 *
 * @param <P> The payload type.
 * @author calm-lake developers
 */
public interface EventHandler<P> {

  // Interface.

  /**
   * Handle a published notification.
   *
   * @param payload The payload, which is null for kinds without one.
   */
  void handle(P payload);
}
