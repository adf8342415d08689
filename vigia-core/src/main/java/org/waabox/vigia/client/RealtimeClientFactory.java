package org.waabox.vigia.client;

/**
 * Creates {@link RealtimeClient} instances for an endpoint.
 *
 * <p>This is the seam where a concrete realtime backend is plugged in.
 * The connection factory calls it once per connection attempt.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RealtimeClientFactory {

  /**
   * Creates a new client for the given endpoint.
   *
   * @param endpoint the endpoint to connect to, never null
   *
   * @return a new client, never null
   *
   * @throws ClientCreationException if the client cannot be constructed
   */
  RealtimeClient create(RealtimeEndpoint endpoint);
}
