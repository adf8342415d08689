package org.waabox.vigia.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.vigia.ConnectionStatusReport;
import org.waabox.vigia.Vigia;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.Channel;
import org.waabox.vigia.client.ChangeListener;
import org.waabox.vigia.client.ChannelStatus;
import org.waabox.vigia.client.ChannelStatusListener;
import org.waabox.vigia.client.RealtimeClient;
import org.waabox.vigia.client.RealtimeClientFactory;
import org.waabox.vigia.client.RealtimeEndpoint;
import org.waabox.vigia.client.Resource;
import org.waabox.vigia.connection.ConnectionStatus;

/**
 * Tests for {@link VigiaAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class VigiaAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(VigiaAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoClientFactory_shouldNotCreateVigia() {
    runner.run(context ->
        assertFalse(context.containsBean("vigia")));
  }

  @Test
  void whenContextLoads_givenClientFactory_shouldInitializeVigia() {
    runner.withUserConfiguration(ClientFactoryConfig.class)
        .withPropertyValues("vigia.url=https://realtime.example.com")
        .run(context -> {
          final Vigia vigia = context.getBean(Vigia.class);
          assertNotNull(vigia);

          // Only an initialized instance answers.
          final ConnectionStatusReport report = vigia.connectionStatus();
          assertEquals(ConnectionStatus.DISCONNECTED, report.status());
        });
  }

  @Test
  void whenContextLoads_givenTopicRegistrar_shouldSubscribeTopics() {
    runner.withUserConfiguration(ClientFactoryConfig.class,
            RegistrarConfig.class)
        .withPropertyValues("vigia.url=https://realtime.example.com")
        .run(context -> {
          final Vigia vigia = context.getBean(Vigia.class);

          final ConnectionStatusReport report = vigia.connectionStatus();
          assertEquals(ConnectionStatus.CONNECTED, report.status());
          assertEquals(1, report.activeTopicCount());
          assertEquals(1, context.getBean(StubClientFactory.class)
              .created.get());
        });
  }

  @Test
  void whenContextLoads_givenProperties_shouldBindOptions() {
    runner.withUserConfiguration(ClientFactoryConfig.class)
        .withPropertyValues(
            "vigia.url=https://realtime.example.com",
            "vigia.api-key=secret",
            "vigia.max-retries=7",
            "vigia.circuit-breaker-threshold=3",
            "vigia.polling-interval=2s",
            "vigia.reconnection-interval=1m",
            "vigia.polling-enabled=false")
        .run(context -> {
          final VigiaProperties properties =
              context.getBean(VigiaProperties.class);
          final VigiaOptions options = properties.toOptions();

          assertEquals("secret", properties.toEndpoint().apiKey());
          assertEquals(7, options.retryPolicy().maxRetries());
          assertEquals(3, options.circuitBreakerThreshold());
          assertEquals(Duration.ofSeconds(2), options.pollingInterval());
          assertEquals(Duration.ofMinutes(1), options.reconnectionInterval());
          assertFalse(options.pollingEnabled());
          assertEquals(Duration.ofSeconds(30),
              options.healthCheckInterval());
        });
  }

  @Test
  void whenContextLoads_givenNoUrl_shouldFail() {
    runner.withUserConfiguration(ClientFactoryConfig.class)
        .run(context -> {
          assertTrue(context.getStartupFailure() != null);
          Throwable cause = context.getStartupFailure();
          while (cause.getCause() != null) {
            cause = cause.getCause();
          }
          assertInstanceOf(IllegalStateException.class, cause);
        });
  }

  @Configuration(proxyBeanMethods = false)
  static class ClientFactoryConfig {

    @Bean
    StubClientFactory stubClientFactory() {
      return new StubClientFactory();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class RegistrarConfig {

    @Bean
    TopicRegistrar ordersRegistrar() {
      return vigia -> vigia.subscribe("orders", Resource.table("orders"),
          event -> { });
    }
  }

  /** A client factory whose channels always join. */
  static class StubClientFactory implements RealtimeClientFactory {

    /** How many clients were created. */
    private final AtomicInteger created = new AtomicInteger();

    @Override
    public RealtimeClient create(
        final RealtimeEndpoint endpoint) {
      created.incrementAndGet();
      return new RealtimeClient() {
        @Override
        public void probe() {
        }

        @Override
        public Channel openChannel(final String topic) {
          return new Channel() {
            @Override
            public Channel onChange(final Resource resource,
                final ChangeListener listener) {
              return this;
            }

            @Override
            public void subscribe(final ChannelStatusListener listener) {
              listener.onStatus(ChannelStatus.SUBSCRIBED, null);
            }

            @Override
            public void unsubscribe() {
            }
          };
        }

        @Override
        public List<Map<String, Object>> query(final Resource resource) {
          return List.of();
        }

        @Override
        public void close() {
        }
      };
    }
  }
}
