package org.waabox.vigia.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.waabox.vigia.Subscription;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.ChangeEvent;
import org.waabox.vigia.client.ChangeType;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.client.Resource;
import org.waabox.vigia.connection.ConnectionFactory;
import org.waabox.vigia.metrics.NoopVigiaMetrics;
import org.waabox.vigia.testing.FakeBackend;
import org.waabox.vigia.testing.ManualTaskScheduler;
import org.waabox.vigia.testing.MutableClock;
import org.waabox.vigia.testing.RecordingSleeper;

/**
 * Tests for {@link PollTransport}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PollTransportTest {

  private static final Resource ORDERS = Resource.table("orders");

  private final MutableClock clock = new MutableClock(
      Instant.parse("2024-05-01T10:00:00Z"));

  private final ManualTaskScheduler scheduler = new ManualTaskScheduler();

  private final FakeBackend backend = new FakeBackend();

  private final List<ChangeEvent> changes = new CopyOnWriteArrayList<>();

  private final List<VigiaException> errors = new CopyOnWriteArrayList<>();

  private final Subscription subscription = Subscription.of("orders", ORDERS,
      changes::add, errors::add);

  private final PollTransport transport = new PollTransport(
      ConnectionFactory.builder(
              new RealtimeEndpoint("https://realtime.example.com", "key"),
              backend, scheduler)
          .options(VigiaOptions.builder().maxRetries(1).build())
          .clock(clock)
          .sleeper(new RecordingSleeper(clock))
          .build(),
      scheduler, Duration.ofSeconds(5), new NoopVigiaMetrics(), clock);

  private static Map<String, Object> row(final Object... keyValues) {
    final Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      row.put((String) keyValues[i], keyValues[i + 1]);
    }
    return row;
  }

  @Test
  void whenPolling_givenSameThenDifferentRows_shouldNotifyOnlyOnChange() {
    final Map<String, Object> a = row("id", 1, "status", "new");
    final Map<String, Object> b = row("id", 1, "status", "paid");
    backend.queryResults(List.of(a), List.of(a), List.of(b));

    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    assertEquals(0, backend.queryCalls());

    handle.activate();
    scheduler.fire("vigia-poll-orders");
    scheduler.fire("vigia-poll-orders");

    assertEquals(3, backend.queryCalls());
    assertEquals(2, changes.size());
    final ChangeEvent last = changes.get(1);
    assertEquals(ChangeType.UPDATE, last.type());
    assertEquals("public", last.schema());
    assertEquals("orders", last.table());
    assertEquals(b, last.newRow());
    assertNull(last.oldRow());
    assertTrue(errors.isEmpty());
  }

  @Test
  void whenPolling_givenSameValuesInOtherKeyOrder_shouldNotNotify() {
    backend.queryResults(
        List.of(row("id", 1, "status", "new")),
        List.of(row("status", "new", "id", 1)));

    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    handle.activate();
    scheduler.fire("vigia-poll-orders");

    assertEquals(1, changes.size());
  }

  @Test
  void whenPolling_givenEmptyResult_shouldNotifyWithoutRow() {
    backend.queryResults(List.of());

    transport.open(subscription, (h, e) -> { }).activate();

    assertEquals(1, changes.size());
    assertFalse(changes.get(0).newValue().isPresent());
  }

  @Test
  void whenPolling_givenFailingQuery_shouldReportAndKeepPolling() {
    backend.failQueries(true);
    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });

    handle.activate();

    assertEquals(1, errors.size());
    assertTrue(errors.get(0) instanceof PollQueryException);
    assertEquals("orders", ((PollQueryException) errors.get(0)).topicKey());
    assertEquals(1, scheduler.liveTasks("vigia-poll-orders"));

    backend.failQueries(false);
    backend.queryResults(List.of(row("id", 7)));
    scheduler.fire("vigia-poll-orders");

    assertEquals(1, changes.size());
  }

  @Test
  void whenClosing_shouldCancelTimerAndStopQuerying() {
    backend.queryResults(List.of(row("id", 1)));
    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    handle.activate();
    assertEquals(Duration.ofSeconds(5),
        scheduler.periodOf("vigia-poll-orders"));

    handle.close();
    handle.close();
    scheduler.fire("vigia-poll-orders");

    assertEquals(0, scheduler.liveTasks());
    assertEquals(1, backend.queryCalls());
  }

  @Test
  void whenActivating_givenClosedHandle_shouldNotPoll() {
    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    handle.close();

    handle.activate();

    assertEquals(0, backend.queryCalls());
    assertEquals(0, scheduler.liveTasks());
  }

  @Test
  void whenClosing_givenTickInFlight_shouldDiscardItsResult()
      throws Exception {
    backend.queryResults(List.of(row("id", 1)), List.of(row("id", 2)));
    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    handle.activate();
    assertEquals(1, changes.size());

    final CountDownLatch gate = new CountDownLatch(1);
    final CountDownLatch reached = new CountDownLatch(1);
    backend.gateQueries(gate, reached);
    final Thread ticker = new Thread(() ->
        scheduler.fire("vigia-poll-orders"));
    ticker.start();
    assertTrue(reached.await(5, TimeUnit.SECONDS));

    handle.close();
    gate.countDown();
    ticker.join(5000);

    assertFalse(ticker.isAlive());
    assertEquals(2, backend.queryCalls());
    assertEquals(1, changes.size());
    assertTrue(errors.isEmpty());
  }

  @Test
  void whenClosing_givenFailingTickInFlight_shouldNotReportError()
      throws Exception {
    backend.queryResults(List.of(row("id", 1)));
    final TransportHandle handle = transport.open(subscription,
        (h, e) -> { });
    handle.activate();

    final CountDownLatch gate = new CountDownLatch(1);
    final CountDownLatch reached = new CountDownLatch(1);
    backend.gateQueries(gate, reached).failQueries(true);
    final Thread ticker = new Thread(() ->
        scheduler.fire("vigia-poll-orders"));
    ticker.start();
    assertTrue(reached.await(5, TimeUnit.SECONDS));

    handle.close();
    gate.countDown();
    ticker.join(5000);

    assertFalse(ticker.isAlive());
    assertTrue(errors.isEmpty());
  }
}
