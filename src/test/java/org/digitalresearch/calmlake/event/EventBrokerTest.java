package org.digitalresearch.calmlake.event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventBrokerTest {

  // Static fields.

  private static final EventKind<String> GREETING = EventKind.named("greeting");
  private static final EventKind<String> FAREWELL = EventKind.named("farewell");

  // Tests.

  @Test
  public void testDeliversInSubscriptionOrder() {
    EventBroker broker = new EventBroker();
    List<String> calls = new ArrayList<String>();
    broker.subscribe(GREETING, new Recorder("first", calls));
    broker.subscribe(GREETING, new Recorder("second", calls));
    broker.subscribe(GREETING, new Recorder("third", calls));

    broker.publish(GREETING, "hi");
    assertEquals(Arrays.asList("first:hi", "second:hi", "third:hi"), calls);
  }

  @Test
  public void testKindsAreSeparate() {
    EventBroker broker = new EventBroker();
    List<String> calls = new ArrayList<String>();
    broker.subscribe(GREETING, new Recorder("greeter", calls));

    broker.publish(FAREWELL, "bye");
    assertTrue(calls.isEmpty());
    assertFalse(broker.hasSubscribers(FAREWELL));

    // Same name, different kind.
    broker.publish(EventKind.<String>named("greeting"), "hi");
    assertTrue(calls.isEmpty());
  }

  @Test
  public void testUnsubscribe() {
    EventBroker broker = new EventBroker();
    List<String> calls = new ArrayList<String>();
    Recorder recorder = new Recorder("r", calls);
    broker.subscribe(GREETING, recorder);

    assertTrue(broker.unsubscribe(GREETING, recorder));
    assertFalse(broker.unsubscribe(GREETING, recorder));
    broker.publish(GREETING, "hi");
    assertTrue(calls.isEmpty());
    assertFalse(broker.hasSubscribers(GREETING));
  }

  @Test
  public void testFailingHandlerDoesNotStopDelivery() {
    EventBroker broker = new EventBroker();
    List<String> calls = new ArrayList<String>();
    broker.subscribe(GREETING, new EventHandler<String>() {
      @Override
      public void handle(String payload) {
        throw new IllegalStateException("boom");
      }
    });
    broker.subscribe(GREETING, new Recorder("survivor", calls));

    broker.publish(GREETING, "hi");
    assertEquals(Arrays.asList("survivor:hi"), calls);
  }

  @Test
  public void testSubscribeDuringDelivery() {
    final EventBroker broker = new EventBroker();
    final List<String> calls = new ArrayList<String>();
    broker.subscribe(GREETING, new EventHandler<String>() {
      @Override
      public void handle(String payload) {
        broker.subscribe(GREETING, new Recorder("late", calls));
      }
    });

    broker.publish(GREETING, "one");
    assertTrue(calls.isEmpty());
    broker.publish(GREETING, "two");
    assertEquals(Arrays.asList("late:two"), calls);
  }

  @Test
  public void testHandlerForSupertype() {
    EventBroker broker = new EventBroker();
    final List<Object> seen = new ArrayList<Object>();
    broker.subscribe(GREETING, new EventHandler<Object>() {
      @Override
      public void handle(Object payload) {
        seen.add(payload);
      }
    });
    broker.publish(GREETING, "hi");
    assertEquals(Arrays.<Object>asList("hi"), seen);
  }

  @Test(expected = NullPointerException.class)
  public void testNullHandler() {
    new EventBroker().subscribe(GREETING, null);
  }

  // Inner classes.

  protected static class Recorder implements EventHandler<String> {

    // Instance fields.

    protected final String name;
    protected final List<String> calls;

    // Implementation.

    public Recorder(String name, List<String> calls) {
      this.name = name;
      this.calls = calls;
    }

    // EventHandler implementation.

    @Override
    public void handle(String payload) {
      calls.add(name + ":" + payload);
    }
  }
}
