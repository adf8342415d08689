package org.waabox.vigia;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link VigiaOptions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class VigiaOptionsTest {

  @Test
  void whenUsingDefaults_shouldMatchDocumentedValues() {
    final VigiaOptions options = VigiaOptions.defaults();

    assertEquals(3, options.retryPolicy().maxRetries());
    assertEquals(Duration.ofSeconds(1), options.retryPolicy().baseDelay());
    assertEquals(Duration.ofSeconds(30), options.retryPolicy().maxDelay());
    assertEquals(5, options.circuitBreakerThreshold());
    assertEquals(Duration.ofSeconds(30), options.healthCheckInterval());
    assertEquals(Duration.ofSeconds(5), options.pollingInterval());
    assertEquals(Duration.ofSeconds(60), options.reconnectionInterval());
    assertEquals(Duration.ofSeconds(10), options.probeTimeout());
    assertEquals(Duration.ofSeconds(10), options.channelSubscribeTimeout());
    assertTrue(options.pollingEnabled());
  }

  @Test
  void whenBuilding_givenOverrides_shouldKeepThem() {
    final VigiaOptions options = VigiaOptions.builder()
        .maxRetries(5)
        .baseRetryDelay(Duration.ofMillis(250))
        .maxRetryDelay(Duration.ofSeconds(8))
        .circuitBreakerThreshold(2)
        .pollingInterval(Duration.ofSeconds(1))
        .pollingEnabled(false)
        .build();

    assertEquals(5, options.retryPolicy().maxRetries());
    assertEquals(Duration.ofMillis(250), options.retryPolicy().baseDelay());
    assertEquals(Duration.ofSeconds(8), options.retryPolicy().maxDelay());
    assertEquals(2, options.circuitBreakerThreshold());
    assertEquals(Duration.ofSeconds(1), options.pollingInterval());
    assertFalse(options.pollingEnabled());
  }

  @Test
  void whenBuilding_givenZeroThreshold_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        VigiaOptions.builder().circuitBreakerThreshold(0));
  }

  @Test
  void whenBuilding_givenNegativeInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        VigiaOptions.builder().pollingInterval(Duration.ofSeconds(-1)));
  }

  @Test
  void whenBuilding_givenMaxDelayBelowBase_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        VigiaOptions.builder()
            .baseRetryDelay(Duration.ofSeconds(10))
            .maxRetryDelay(Duration.ofSeconds(5))
            .build());
  }
}
