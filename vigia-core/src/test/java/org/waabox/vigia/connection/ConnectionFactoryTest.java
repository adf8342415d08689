package org.waabox.vigia.connection;

import static org.easymock.EasyMock.anyInt;
import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.ClientCreationException;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.metrics.NoopVigiaMetrics;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.ExecutorTaskScheduler;
import org.waabox.vigia.schedule.TaskScheduler;
import org.waabox.vigia.testing.FakeBackend;
import org.waabox.vigia.testing.ManualTaskScheduler;
import org.waabox.vigia.testing.MutableClock;
import org.waabox.vigia.testing.RecordingSleeper;

/**
 * Tests for {@link ConnectionFactory}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConnectionFactoryTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  private static final RealtimeEndpoint ENDPOINT = new RealtimeEndpoint(
      "https://realtime.example.com", "key");

  private final MutableClock clock = new MutableClock(START);

  private final RecordingSleeper sleeper = new RecordingSleeper(clock);

  private final ManualTaskScheduler scheduler = new ManualTaskScheduler();

  private final FakeBackend backend = new FakeBackend();

  private ConnectionFactory factory(final VigiaOptions options,
      final VigiaMetrics metrics, final TaskScheduler theScheduler) {
    return ConnectionFactory.builder(ENDPOINT, backend, theScheduler)
        .options(options)
        .metrics(metrics)
        .clock(clock)
        .sleeper(sleeper)
        .jitter(() -> 0)
        .build();
  }

  private ConnectionFactory factory(final VigiaOptions options) {
    return factory(options, new NoopVigiaMetrics(), scheduler);
  }

  private static VigiaOptions threshold(final int threshold) {
    return VigiaOptions.builder()
        .maxRetries(3)
        .circuitBreakerThreshold(threshold)
        .build();
  }

  @Test
  void whenConnecting_givenHealthyBackend_shouldCacheSharedClient() {
    final ConnectionFactory factory = factory(VigiaOptions.defaults());

    final RealtimeClient first = factory.getConnection();
    final RealtimeClient second = factory.getConnection();

    assertSame(first, second);
    assertEquals(1, backend.createCalls());
    assertEquals(ConnectionStatus.CONNECTED, factory.health().status());
    assertEquals(0, factory.health().failureCount());
    assertEquals(START, factory.health().lastConnectedAt().get());
    assertTrue(sleeper.delays().isEmpty());
  }

  @Test
  void whenConnecting_givenTransientFailures_shouldBackOffAndSucceed() {
    backend.failNextCreations(2);
    final VigiaMetrics metrics = createMock(VigiaMetrics.class);
    metrics.connectionAttemptFailed(anyInt(), anyObject(Throwable.class));
    expectLastCall().times(2);
    metrics.connectionEstablished(3);
    expectLastCall().once();
    replay(metrics);

    final ConnectionFactory factory = factory(VigiaOptions.defaults(),
        metrics, scheduler);
    factory.getConnection();

    assertEquals(3, backend.createCalls());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)),
        sleeper.delays());
    assertEquals(ConnectionStatus.CONNECTED, factory.health().status());
    assertEquals(0, factory.health().failureCount());
    verify(metrics);
  }

  @Test
  void whenConnecting_givenBackendDown_shouldTripCircuitAndRejectFast() {
    backend.down();
    final VigiaMetrics metrics = createMock(VigiaMetrics.class);
    metrics.connectionAttemptFailed(anyInt(), anyObject(Throwable.class));
    expectLastCall().times(3);
    metrics.circuitRejected();
    expectLastCall().once();
    replay(metrics);

    final ConnectionFactory factory = factory(threshold(2), metrics,
        scheduler);

    final ConnectionUnavailableException exhausted = assertThrows(
        ConnectionUnavailableException.class, factory::getConnection);

    assertEquals(3, backend.createCalls());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)),
        sleeper.delays());
    assertEquals(ConnectionStatus.FAILED, factory.health().status());
    assertEquals(3, factory.health().failureCount());
    final Instant retryAt = START.plusSeconds(3).plusSeconds(30);
    assertEquals(retryAt, factory.health().nextRetryAt().get());
    assertEquals(retryAt, exhausted.retryAfter().get());
    assertEquals(CircuitState.OPEN, factory.circuitState());

    final ConnectionUnavailableException rejected = assertThrows(
        ConnectionUnavailableException.class, factory::getConnection);

    assertEquals("circuit open", rejected.reason());
    assertEquals(retryAt, rejected.retryAfter().get());
    assertEquals(3, backend.createCalls());
    verify(metrics);
  }

  @Test
  void whenCoolDownElapsed_givenBackendBack_shouldCloseCircuit() {
    backend.down();
    final ConnectionFactory factory = factory(threshold(2));
    assertThrows(ConnectionUnavailableException.class,
        factory::getConnection);

    clock.advance(Duration.ofSeconds(30));
    assertEquals(CircuitState.HALF_OPEN, factory.circuitState());
    backend.up();

    factory.getConnection();

    assertEquals(4, backend.createCalls());
    assertEquals(ConnectionStatus.CONNECTED, factory.health().status());
    assertEquals(0, factory.health().failureCount());
    assertEquals(CircuitState.CLOSED, factory.circuitState());
  }

  @Test
  void whenCoolDownElapsed_givenBackendStillDown_shouldReopenCircuit() {
    backend.down();
    final ConnectionFactory factory = factory(threshold(2));
    assertThrows(ConnectionUnavailableException.class,
        factory::getConnection);
    clock.advance(Duration.ofSeconds(30));

    assertThrows(ConnectionUnavailableException.class,
        factory::getConnection);

    assertEquals(6, backend.createCalls());
    assertEquals(4, factory.health().failureCount());
    assertEquals(clock.instant().plusSeconds(30),
        factory.health().nextRetryAt().get());
    assertEquals(CircuitState.OPEN, factory.circuitState());
  }

  @Test
  void whenConnectingConcurrently_shouldCreateOneClient() throws Exception {
    final CountDownLatch gate = new CountDownLatch(1);
    backend.gateCreation(gate);
    final ConnectionFactory factory = factory(VigiaOptions.defaults());

    final ExecutorService callers = Executors.newFixedThreadPool(8);
    final List<Future<RealtimeClient>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      results.add(callers.submit(factory::getConnection));
    }
    Thread.sleep(100);
    gate.countDown();

    final RealtimeClient first = results.get(0).get(5, TimeUnit.SECONDS);
    for (final Future<RealtimeClient> result : results) {
      assertSame(first, result.get(5, TimeUnit.SECONDS));
    }
    callers.shutdownNow();

    assertEquals(1, backend.createCalls());
  }

  @Test
  void whenHealthProbeFails_shouldDegradeAndDropClient() {
    final VigiaOptions options = VigiaOptions.builder().maxRetries(1).build();
    final ConnectionFactory factory = factory(options);
    final List<ConnectionHealth> notified = new CopyOnWriteArrayList<>();
    factory.addListener(notified::add);

    final RealtimeClient first = factory.getConnection();
    factory.startHealthChecks();
    assertEquals(1, scheduler.liveTasks("vigia-health-probe"));
    assertEquals(Duration.ofSeconds(30),
        scheduler.periodOf("vigia-health-probe"));

    backend.failProbes(true);
    scheduler.fire("vigia-health-probe");

    assertEquals(ConnectionStatus.POLLING, factory.health().status());
    assertEquals(1, factory.health().failureCount());
    assertTrue(backend.clients().get(0).isClosed());
    assertEquals(ConnectionStatus.POLLING,
        notified.get(notified.size() - 1).status());

    backend.failProbes(false);
    final RealtimeClient second = factory.getConnection();

    assertNotSame(first, second);
    assertEquals(ConnectionStatus.CONNECTED, factory.health().status());
    assertEquals(0, factory.health().failureCount());
  }

  @Test
  void whenHealthProbeSucceeds_shouldKeepClient() {
    final ConnectionFactory factory = factory(VigiaOptions.defaults());
    final RealtimeClient client = factory.getConnection();
    factory.startHealthChecks();

    scheduler.fire("vigia-health-probe");

    assertSame(client, factory.getConnection());
    assertEquals(ConnectionStatus.CONNECTED, factory.health().status());
  }

  @Test
  void whenProbeHangs_shouldFailWithProbeTimeout() {
    backend.probeDelay(500);
    final ExecutorTaskScheduler realScheduler = new ExecutorTaskScheduler();
    try {
      final VigiaOptions options = VigiaOptions.builder()
          .maxRetries(1)
          .probeTimeout(Duration.ofMillis(50))
          .build();
      final ConnectionFactory factory = factory(options,
          new NoopVigiaMetrics(), realScheduler);

      final ConnectionUnavailableException error = assertThrows(
          ConnectionUnavailableException.class, factory::getConnection);

      assertInstanceOf(ConnectionProbeException.class, error.getCause());
      assertTrue(backend.clients().get(0).isClosed());
    } finally {
      realScheduler.shutdown();
    }
  }

  @Test
  void whenClientFactoryReturnsNull_shouldFailWithCreationError() {
    final ConnectionFactory factory = ConnectionFactory.builder(ENDPOINT,
            endpoint -> null, scheduler)
        .options(VigiaOptions.builder().maxRetries(1).build())
        .clock(clock)
        .sleeper(sleeper)
        .build();

    final ConnectionUnavailableException error = assertThrows(
        ConnectionUnavailableException.class, factory::getConnection);

    assertInstanceOf(ClientCreationException.class, error.getCause());
    assertEquals(ConnectionStatus.FAILED, factory.health().status());
  }

  @Test
  void whenDestroyed_shouldReleaseEverything() {
    final ConnectionFactory factory = factory(VigiaOptions.defaults());
    factory.getConnection();
    factory.startHealthChecks();

    factory.destroy();

    assertEquals(0, scheduler.liveTasks());
    assertTrue(backend.clients().get(0).isClosed());
    assertEquals(ConnectionStatus.DISCONNECTED, factory.health().status());
    assertThrows(IllegalStateException.class, factory::getConnection);
    assertThrows(IllegalStateException.class, factory::startHealthChecks);
  }
}
