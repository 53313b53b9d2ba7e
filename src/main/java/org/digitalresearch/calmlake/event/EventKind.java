package org.digitalresearch.calmlake.event;

/**
 * A typed key for a kind of notification. Two kinds are the same kind only
 * if they are the same instance, so kinds are usually kept in constants and
 * handed out by the component that publishes them.
 *
 * @param <P> The type of the payload delivered with this kind of notification.
 * @author calm-lake developers
 */
public final class EventKind<P> {

  // Instance fields.

  private final String name;

  // Implementation.

  private EventKind(String name) {
    this.name = name;
  }

  /**
   * Create a new kind of notification.
   *
   * @param name A name used in log messages.
   * @return A new kind, distinct from every other kind.
   */
  public static <P> EventKind<P> named(String name) {
    if (name == null) throw new NullPointerException("name");
    return new EventKind<P>(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
