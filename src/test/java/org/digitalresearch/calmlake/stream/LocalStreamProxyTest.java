package org.digitalresearch.calmlake.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class LocalStreamProxyTest {

  // Tests.

  @Test
  public void testRejectsBeforeConnect() {
    LocalStreamProxy<String, String> proxy =
        new LocalStreamProxy<String, String>(new ArrayBlockingQueue<String>(4));
    assertFalse(proxy.send("too early"));
  }

  @Test
  public void testLifecycle() {
    BlockingQueue<String> queue = new ArrayBlockingQueue<String>(1);
    LocalStreamProxy<String, String> proxy = new LocalStreamProxy<String, String>(queue);
    RecordingListener<String> listener = new RecordingListener<String>();

    proxy.connect(listener);
    assertTrue(proxy.isConnected());
    assertTrue(proxy.send("a"));
    assertFalse(proxy.send("b"));
    assertEquals("a", queue.poll());

    proxy.receive("reply");
    proxy.fail(new IllegalStateException("cable cut"));
    assertFalse(proxy.send("c"));

    // Nothing is delivered from a failed proxy.
    proxy.receive("ghost");
    proxy.close();
    proxy.close();

    List<String> expected = new ArrayList<String>();
    expected.add("connected");
    expected.add("data:reply");
    expected.add("error:cable cut");
    expected.add("closed");
    assertEquals(expected, listener.events);
    assertTrue(proxy.isClosed());
  }

  @Test
  public void testFactorySharesQueue() {
    BlockingQueue<String> queue = new ArrayBlockingQueue<String>(4);
    StreamProxyFactory<String, String> factory = LocalStreamProxy.factory(queue);
    StreamProxy<String, String> first = factory.create();
    StreamProxy<String, String> second = factory.create();
    assertNotSame(first, second);

    first.connect(new RecordingListener<String>());
    second.connect(new RecordingListener<String>());
    first.send("1");
    second.send("2");
    assertEquals("1", queue.poll());
    assertEquals("2", queue.poll());
  }

  @Test(expected = IllegalStateException.class)
  public void testCannotReconnectClosedProxy() {
    LocalStreamProxy<String, String> proxy =
        new LocalStreamProxy<String, String>(new ArrayBlockingQueue<String>(1));
    proxy.close();
    proxy.connect(new RecordingListener<String>());
  }

  // Inner classes.

  public static class RecordingListener<R> implements StreamProxyListener<R> {

    // Instance fields.

    public final List<String> events = new ArrayList<String>();

    // StreamProxyListener implementation.

    @Override
    public void onConnected() {
      events.add("connected");
    }

    @Override
    public void onData(R data) {
      events.add("data:" + data);
    }

    @Override
    public void onError(Throwable cause) {
      events.add("error:" + cause.getMessage());
    }

    @Override
    public void onClosed() {
      events.add("closed");
    }
  }
}
