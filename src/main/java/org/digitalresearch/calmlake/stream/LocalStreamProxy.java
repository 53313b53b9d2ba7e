package org.digitalresearch.calmlake.stream;

import java.util.concurrent.BlockingQueue;

/**
 * A StreamProxy that uses a simple in-memory queue as a "transport". It is
 * connected as soon as connect is called, and a full queue makes it reject
 * sends, just like a congested socket would. Inbound data and failures are
 * injected with receive and fail, which makes it handy in tests and for
 * wiring components within one process.
 *
 * @param <T> The type of items sent through the queue.
 * @param <R> The type of data received.
 * @author calm-lake developers
 */
public class LocalStreamProxy<T, R> implements StreamProxy<T, R> {

  // Instance fields.

  protected final BlockingQueue<T> queue;

  protected StreamProxyListener<R> listener;
  protected boolean connected;
  protected boolean closed;

  // Implementation.

  public LocalStreamProxy(BlockingQueue<T> queue) {
    if (queue == null) throw new NullPointerException("queue");
    this.queue = queue;
  }

  /**
   * A factory for proxies that all share the specified queue, so that a
   * consumer keeps draining the same queue across reconnects.
   *
   * @param queue The shared queue.
   * @return A factory of local proxies.
   */
  public static <T, R> StreamProxyFactory<T, R> factory(final BlockingQueue<T> queue) {
    return new StreamProxyFactory<T, R>() {
      @Override
      public StreamProxy<T, R> create() {
        return new LocalStreamProxy<T, R>(queue);
      }
    };
  }

  /**
   * Simulate data arriving from the remote end.
   *
   * @param data The data to deliver to the listener.
   */
  public void receive(R data) {
    if (listener != null && connected && !closed) listener.onData(data);
  }

  /**
   * Simulate a transport failure. The proxy rejects sends afterwards.
   *
   * @param cause The failure to report.
   */
  public void fail(Throwable cause) {
    if (closed || !connected) return;
    connected = false;
    listener.onError(cause);
  }

  public boolean isConnected() {
    return connected;
  }

  public boolean isClosed() {
    return closed;
  }

  // StreamProxy implementation.

  @Override
  public void connect(StreamProxyListener<R> listener) {
    if (closed) throw new IllegalStateException("Proxy is closed");
    this.listener = listener;
    connected = true;
    listener.onConnected();
  }

  @Override
  public boolean send(T item) {
    if (!connected || closed) return false;
    return queue.offer(item);
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    connected = false;
    if (listener != null) listener.onClosed();
  }
}
