package org.waabox.vigia.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.vigia.Vigia;
import org.waabox.vigia.client.RealtimeClientFactory;
import org.waabox.vigia.metrics.VigiaMetrics;

/**
 * Spring Boot auto-configuration for the Vigia synchronization layer.
 *
 * <p>This configuration creates a singleton {@link Vigia} instance as soon
 * as the application context holds a {@link RealtimeClientFactory} bean.
 * Options and endpoint come from {@link VigiaProperties}; an optional
 * {@link VigiaMetrics} bean is wired in when present.
 *
 * <p>The Vigia lifecycle is managed through Spring's
 * {@link SmartLifecycle}: on start the instance is initialized and every
 * {@link TopicRegistrar} bean subscribes its topics, on stop the instance
 * is destroyed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@ConditionalOnBean(RealtimeClientFactory.class)
@EnableConfigurationProperties(VigiaProperties.class)
public class VigiaAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      VigiaAutoConfiguration.class);

  /**
   * Creates the singleton {@link Vigia} bean.
   *
   * @param properties      the configuration properties, never null
   * @param clientFactory   the realtime client factory, never null
   * @param metricsProvider provider for an optional VigiaMetrics bean
   *
   * @return the configured, not yet initialized Vigia instance, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Vigia vigia(final VigiaProperties properties,
      final RealtimeClientFactory clientFactory,
      final ObjectProvider<VigiaMetrics> metricsProvider) {

    requireAtMostOne(metricsProvider, VigiaMetrics.class);

    final Vigia.Builder builder = Vigia.builder()
        .endpoint(properties.toEndpoint())
        .clientFactory(clientFactory)
        .options(properties.toOptions());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Vigia using custom VigiaMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    log.info("Vigia created for {} using {}", properties.toEndpoint(),
        clientFactory.getClass().getSimpleName());

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that initializes Vigia, runs the
   * topic registrars and destroys Vigia on shutdown.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * so the beans the registrars deliver changes to are ready, and stops
   * early for the same reason.
   *
   * @param vigia      the Vigia instance to manage, never null
   * @param registrars the topic registrars, may be empty
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle vigiaLifecycle(final Vigia vigia,
      final List<TopicRegistrar> registrars) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Vigia lifecycle...");
        vigia.initialize();
        for (final TopicRegistrar registrar : registrars) {
          registrar.register(vigia);
          log.debug("Invoked TopicRegistrar: {}",
              registrar.getClass().getSimpleName());
        }
        running = true;
        log.info("Vigia lifecycle started with {} registrar(s).",
            registrars.size());
      }

      @Override
      public void stop() {
        log.info("Stopping Vigia lifecycle...");
        vigia.destroy();
        running = false;
        log.info("Vigia lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Vigia requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
