package org.waabox.vigia.client;

import java.util.List;
import java.util.Map;

/**
 * A handle to the remote realtime service.
 *
 * <p>The wire protocol behind this interface is opaque to Vigia: a client
 * only needs to answer a cheap connectivity probe, open named channels
 * that stream row-level change events, and run a one-off query against a
 * {@link Resource}.
 *
 * <p>A single client is shared by every subscription; only the
 * {@link org.waabox.vigia.connection.ConnectionFactory} creates and closes
 * it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RealtimeClient extends AutoCloseable {

  /**
   * Runs a lightweight connectivity check.
   *
   * @throws RuntimeException if the service cannot be reached
   */
  void probe();

  /**
   * Opens a named channel. The channel is not subscribed until
   * {@link Channel#subscribe(ChannelStatusListener)} is called.
   *
   * @param topic the channel name, never null
   *
   * @return the channel, never null
   */
  Channel openChannel(String topic);

  /**
   * Queries the current rows of the given resource.
   *
   * @param resource the resource to query, never null
   *
   * @return the rows, never null, possibly empty
   *
   * @throws RuntimeException if the query fails
   */
  List<Map<String, Object>> query(Resource resource);

  /** Releases the client and every channel it still holds. */
  @Override
  void close();
}
