package org.digitalresearch.calmlake.stream;

/**
 * A StreamProxy wraps one instance of a possibly unreliable transport, such
 * as a socket or a file. A proxy is used once: when it breaks, its owner
 * throws it away and asks a StreamProxyFactory for a new one.
 * <p/>
 * CalmLake -> Controller -> StreamProxy -> [...]
 *
 * @param <T> The type of items sent through the transport.
 * @param <R> The type of data received from the transport.
 * @author calm-lake developers
 */
public interface StreamProxy<T, R> {

  // Interface.

  /**
   * Start establishing the transport. The listener is told about the outcome,
   * either from within this call or later.
   *
   * @param listener The listener for all events of this proxy.
   */
  void connect(StreamProxyListener<R> listener);

  /**
   * Hand an item to the transport. Must not block.
   *
   * @param item The item to send.
   * @return True if the transport took the item, false if it cannot take it now.
   */
  boolean send(T item);

  /**
   * Release the transport. Closing twice is harmless.
   */
  void close();
}
