package org.digitalresearch.calmlake;

import org.digitalresearch.calmlake.event.EventKind;

/**
 * The kinds of notification a CalmLake publishes to its subscribers, apart
 * from data, which has a kind per lake (CalmLake.dataEvent).
 *
 * @author calm-lake developers
 */
public final class LakeEvents {

  // Static fields.

  private static final EventKind<Throwable> ERROR = EventKind.<Throwable>named("error");

  // Implementation.

  private LakeEvents() {
  }

  /**
   * A transport failure. Recovery is up to the controller; the lake keeps
   * buffering until it is ready again.
   */
  public static EventKind<Throwable> error() {
    return ERROR;
  }
}
