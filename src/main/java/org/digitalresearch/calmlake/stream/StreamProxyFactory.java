package org.digitalresearch.calmlake.stream;

/**
 * Creates fresh stream proxies, one per (re)connection attempt.
 *
 * @param <T> The type of items sent through the transport.
 * @param <R> The type of data received from the transport.
 * @author calm-lake developers
 */
public interface StreamProxyFactory<T, R> {

  // Interface.

  /**
   * @return A new, not yet connected proxy.
   */
  StreamProxy<T, R> create();
}
