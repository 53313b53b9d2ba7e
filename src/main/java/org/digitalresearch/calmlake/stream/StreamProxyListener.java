package org.digitalresearch.calmlake.stream;

/**
 * Callback interface used by a StreamProxy to tell its owner what happens on
 * the underlying transport.
 *
 * @param <R> The type of data received from the transport.
 * @author calm-lake developers
 */
public interface StreamProxyListener<R> {

  // Interface.

  /**
   * The transport is established and the proxy accepts sends from now on.
   */
  void onConnected();

  /**
   * Data arrived from the transport.
   *
   * @param data The received data.
   */
  void onData(R data);

  /**
   * The transport failed. The proxy is not usable anymore.
   *
   * @param cause What went wrong.
   */
  void onError(Throwable cause);

  /**
   * The transport is closed, either on request or by the remote end.
   */
  void onClosed();
}
