package org.waabox.vigia.spring;

import org.waabox.vigia.Vigia;

/**
 * A callback interface for subscribing topics on the {@link Vigia}
 * instance created by the Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to subscribe one or more
 * topics. All discovered {@code TopicRegistrar} beans are invoked right
 * after {@link Vigia#initialize()}, when the application context starts.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * TopicRegistrar ordersTopicRegistrar(OrderBoard board) {
 *     return vigia -> vigia.subscribe("orders",
 *         Resource.table("orders").filteredBy("store_id eq 12"),
 *         board::onChange);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TopicRegistrar {

  /**
   * Subscribes one or more topics on the given Vigia instance.
   *
   * @param vigia the initialized Vigia instance, never null
   */
  void register(Vigia vigia);
}
