package org.waabox.vigia.client;

import java.util.Objects;

/**
 * The address and credentials of the remote realtime service.
 *
 * @param url    the service url, never null or blank
 * @param apiKey the api key used to create clients, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RealtimeEndpoint(String url, String apiKey) {

  /**
   * Validates the endpoint components.
   *
   * @param url    the service url, never null or blank
   * @param apiKey the api key, never null
   */
  public RealtimeEndpoint {
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(apiKey, "apiKey cannot be null");
    if (url.isBlank()) {
      throw new IllegalArgumentException("url cannot be blank");
    }
  }

  /** Masks the api key so endpoints can be logged safely.
   *
   * @return a description of this endpoint, never null
   */
  @Override
  public String toString() {
    return "RealtimeEndpoint[url=" + url + ", apiKey=***]";
  }
}
