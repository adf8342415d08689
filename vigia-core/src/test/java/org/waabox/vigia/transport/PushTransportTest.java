package org.waabox.vigia.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;
import org.waabox.vigia.Subscription;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.ChangeEvent;
import org.waabox.vigia.client.ChangeType;
import org.waabox.vigia.client.ChannelStatus;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.client.Resource;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.connection.ConnectionUnavailableException;
import org.waabox.vigia.testing.FakeBackend;
import org.waabox.vigia.testing.FakeChannel;
import org.waabox.vigia.testing.ManualTaskScheduler;
import org.waabox.vigia.testing.MutableClock;
import org.waabox.vigia.testing.RecordingSleeper;

/**
 * Tests for {@link PushTransport}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PushTransportTest {

  private static final Resource ORDERS = Resource.table("orders");

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);

  private final FakeBackend backend = new FakeBackend();

  private final List<ChangeEvent> changes = new CopyOnWriteArrayList<>();

  private final List<VigiaException> failures = new CopyOnWriteArrayList<>();

  private final Subscription subscription = Subscription.of("orders", ORDERS,
      changes::add);

  private final PushTransport transport = new PushTransport(
      ConnectionFactory.builder(
              new RealtimeEndpoint("https://realtime.example.com", "key"),
              backend, new ManualTaskScheduler())
          .options(VigiaOptions.builder().maxRetries(1).build())
          .clock(clock)
          .sleeper(new RecordingSleeper(clock))
          .build(),
      Duration.ofMillis(100));

  private TransportHandle open() {
    return transport.open(subscription, (handle, cause) ->
        failures.add(cause));
  }

  private static ChangeEvent insert() {
    return new ChangeEvent(ChangeType.INSERT, "public", "orders",
        Map.of("id", 1), null, NOW);
  }

  @Test
  void whenOpening_givenSubscribedChannel_shouldDeliverAfterActivation() {
    final TransportHandle handle = open();
    final FakeChannel channel = backend.lastChannel("orders");

    assertEquals(TransportKind.PUSH, handle.kind());
    assertEquals(ORDERS, channel.resource());
    assertTrue(channel.isOpen());

    channel.emit(insert());
    assertTrue(changes.isEmpty());

    handle.activate();
    channel.emit(insert());
    assertEquals(1, changes.size());
    assertEquals(ChangeType.INSERT, changes.get(0).type());
  }

  @Test
  void whenOpening_givenRejectedChannel_shouldFailAndLeaveChannel() {
    backend.channels(FakeChannel.Behavior.REJECT);

    final SubscriptionOpenException error = assertThrows(
        SubscriptionOpenException.class, this::open);

    assertEquals("orders", error.topicKey());
    assertTrue(backend.lastChannel("orders").isUnsubscribed());
  }

  @Test
  void whenOpening_givenSilentChannel_shouldTimeOut() {
    backend.channels(FakeChannel.Behavior.SILENT);

    final SubscriptionOpenException error = assertThrows(
        SubscriptionOpenException.class, this::open);

    assertTrue(error.getMessage().contains(ChannelStatus.TIMED_OUT.name()));
    assertTrue(backend.lastChannel("orders").isUnsubscribed());
  }

  @Test
  void whenOpening_givenConnectionUnavailable_shouldFail() {
    backend.down();

    final SubscriptionOpenException error = assertThrows(
        SubscriptionOpenException.class, this::open);

    assertInstanceOf(ConnectionUnavailableException.class, error.getCause());
    assertTrue(backend.allChannels().isEmpty());
  }

  @Test
  void whenChannelDrops_shouldNotifyFailureOnce() {
    final TransportHandle handle = open();
    handle.activate();
    final FakeChannel channel = backend.lastChannel("orders");

    channel.report(ChannelStatus.CHANNEL_ERROR);
    channel.report(ChannelStatus.CLOSED);

    assertEquals(1, failures.size());
    assertInstanceOf(SubscriptionOpenException.class, failures.get(0));
    assertTrue(handle.failure().isPresent());
  }

  @Test
  void whenClosedOnRequest_shouldNotNotifyFailure() {
    final TransportHandle handle = open();
    handle.activate();
    final FakeChannel channel = backend.lastChannel("orders");

    handle.close();
    channel.report(ChannelStatus.CLOSED);
    channel.emit(insert());

    assertTrue(failures.isEmpty());
    assertTrue(changes.isEmpty());
    assertTrue(channel.isUnsubscribed());
  }
}
