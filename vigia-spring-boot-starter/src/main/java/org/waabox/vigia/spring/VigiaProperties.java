package org.waabox.vigia.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.vigia.VigiaOptions;
import org.waabox.vigia.client.RealtimeEndpoint;

/**
 * Configuration properties for Vigia, mapped from the {@code vigia.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code vigia.url} - the realtime service url, required.</li>
 *   <li>{@code vigia.api-key} - the api key, defaults to empty.</li>
 *   <li>{@code vigia.max-retries}, {@code vigia.base-retry-delay},
 *       {@code vigia.max-retry-delay} - the connection retry policy.</li>
 *   <li>{@code vigia.circuit-breaker-threshold} - failures that open the
 *       circuit.</li>
 *   <li>{@code vigia.health-check-interval}, {@code vigia.probe-timeout},
 *       {@code vigia.channel-subscribe-timeout} - connection checks.</li>
 *   <li>{@code vigia.polling-enabled}, {@code vigia.polling-interval},
 *       {@code vigia.reconnection-interval} - the poll fallback.</li>
 * </ul>
 *
 * <p>Unset options keep the defaults of {@link VigiaOptions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "vigia")
public class VigiaProperties {

  private String url;

  private String apiKey = "";

  private Integer maxRetries;

  private Duration baseRetryDelay;

  private Duration maxRetryDelay;

  private Integer circuitBreakerThreshold;

  private Duration healthCheckInterval;

  private Duration pollingInterval;

  private Duration reconnectionInterval;

  private Duration probeTimeout;

  private Duration channelSubscribeTimeout;

  private Boolean pollingEnabled;

  /**
   * Builds the endpoint from {@code vigia.url} and {@code vigia.api-key}.
   *
   * @return the endpoint, never null
   *
   * @throws IllegalStateException if {@code vigia.url} is not set
   */
  public RealtimeEndpoint toEndpoint() {
    if (url == null || url.isBlank()) {
      throw new IllegalStateException("vigia.url must be set");
    }
    return new RealtimeEndpoint(url, apiKey == null ? "" : apiKey);
  }

  /**
   * Builds the options, applying only the properties that were set.
   *
   * @return the options, never null
   */
  public VigiaOptions toOptions() {
    final VigiaOptions.Builder builder = VigiaOptions.builder();
    if (maxRetries != null) {
      builder.maxRetries(maxRetries);
    }
    if (baseRetryDelay != null) {
      builder.baseRetryDelay(baseRetryDelay);
    }
    if (maxRetryDelay != null) {
      builder.maxRetryDelay(maxRetryDelay);
    }
    if (circuitBreakerThreshold != null) {
      builder.circuitBreakerThreshold(circuitBreakerThreshold);
    }
    if (healthCheckInterval != null) {
      builder.healthCheckInterval(healthCheckInterval);
    }
    if (pollingInterval != null) {
      builder.pollingInterval(pollingInterval);
    }
    if (reconnectionInterval != null) {
      builder.reconnectionInterval(reconnectionInterval);
    }
    if (probeTimeout != null) {
      builder.probeTimeout(probeTimeout);
    }
    if (channelSubscribeTimeout != null) {
      builder.channelSubscribeTimeout(channelSubscribeTimeout);
    }
    if (pollingEnabled != null) {
      builder.pollingEnabled(pollingEnabled);
    }
    return builder.build();
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(final String url) {
    this.url = url;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(final String apiKey) {
    this.apiKey = apiKey;
  }

  public Integer getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(final Integer maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getBaseRetryDelay() {
    return baseRetryDelay;
  }

  public void setBaseRetryDelay(final Duration baseRetryDelay) {
    this.baseRetryDelay = baseRetryDelay;
  }

  public Duration getMaxRetryDelay() {
    return maxRetryDelay;
  }

  public void setMaxRetryDelay(final Duration maxRetryDelay) {
    this.maxRetryDelay = maxRetryDelay;
  }

  public Integer getCircuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  public void setCircuitBreakerThreshold(
      final Integer circuitBreakerThreshold) {
    this.circuitBreakerThreshold = circuitBreakerThreshold;
  }

  public Duration getHealthCheckInterval() {
    return healthCheckInterval;
  }

  public void setHealthCheckInterval(final Duration healthCheckInterval) {
    this.healthCheckInterval = healthCheckInterval;
  }

  public Duration getPollingInterval() {
    return pollingInterval;
  }

  public void setPollingInterval(final Duration pollingInterval) {
    this.pollingInterval = pollingInterval;
  }

  public Duration getReconnectionInterval() {
    return reconnectionInterval;
  }

  public void setReconnectionInterval(final Duration reconnectionInterval) {
    this.reconnectionInterval = reconnectionInterval;
  }

  public Duration getProbeTimeout() {
    return probeTimeout;
  }

  public void setProbeTimeout(final Duration probeTimeout) {
    this.probeTimeout = probeTimeout;
  }

  public Duration getChannelSubscribeTimeout() {
    return channelSubscribeTimeout;
  }

  public void setChannelSubscribeTimeout(
      final Duration channelSubscribeTimeout) {
    this.channelSubscribeTimeout = channelSubscribeTimeout;
  }

  public Boolean getPollingEnabled() {
    return pollingEnabled;
  }

  public void setPollingEnabled(final Boolean pollingEnabled) {
    this.pollingEnabled = pollingEnabled;
  }
}
