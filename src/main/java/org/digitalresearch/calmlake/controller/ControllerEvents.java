package org.digitalresearch.calmlake.controller;

import org.digitalresearch.calmlake.event.EventKind;

/**
 * The kinds of notification every Controller publishes. Data has a kind per
 * controller, see Controller.dataEvent.
 *
 * @author calm-lake developers
 */
public final class ControllerEvents {

  // Static fields.

  private static final EventKind<Throwable> ERROR = EventKind.<Throwable>named("error");
  private static final EventKind<Void> READY = EventKind.<Void>named("ready");

  // Implementation.

  private ControllerEvents() {
  }

  /**
   * A failure of the current stream proxy.
   */
  public static EventKind<Throwable> error() {
    return ERROR;
  }

  /**
   * A stream proxy got connected, for the first time or after a failure.
   * Published with a null payload.
   */
  public static EventKind<Void> ready() {
    return READY;
  }
}
