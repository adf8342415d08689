package org.waabox.vigia;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.client.ChangeEvent;
import org.waabox.vigia.client.ChangeListener;
import org.waabox.vigia.client.Resource;

/**
 * A topic subscription: the topic key, the resource it selects and the
 * callbacks interested in its changes.
 *
 * <p>Callback exceptions are caught and logged by {@link #deliver} and
 * {@link #reportError} so a misbehaving listener never breaks a
 * transport.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Subscription {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(Subscription.class);

  /** The unique topic key, never null. */
  private final String key;

  /** The selected resource, never null. */
  private final Resource resource;

  /** The change callback, never null. */
  private final ChangeListener changeListener;

  /** The optional error callback, may be null. */
  private final ErrorListener errorListener;

  private Subscription(final String theKey, final Resource theResource,
      final ChangeListener theChangeListener,
      final ErrorListener theErrorListener) {
    key = theKey;
    resource = theResource;
    changeListener = theChangeListener;
    errorListener = theErrorListener;
  }

  /**
   * Creates a subscription without error callback.
   *
   * @param key            the topic key, never null or blank
   * @param resource       the resource, never null
   * @param changeListener the change callback, never null
   *
   * @return a new subscription, never null
   */
  public static Subscription of(final String key, final Resource resource,
      final ChangeListener changeListener) {
    return of(key, resource, changeListener, null);
  }

  /**
   * Creates a subscription.
   *
   * @param key            the topic key, never null or blank
   * @param resource       the resource, never null
   * @param changeListener the change callback, never null
   * @param errorListener  the error callback, may be null
   *
   * @return a new subscription, never null
   */
  public static Subscription of(final String key, final Resource resource,
      final ChangeListener changeListener,
      final ErrorListener errorListener) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(resource, "resource cannot be null");
    Objects.requireNonNull(changeListener, "changeListener cannot be null");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key cannot be blank");
    }
    return new Subscription(key, resource, changeListener, errorListener);
  }

  public String key() {
    return key;
  }

  public Resource resource() {
    return resource;
  }

  public ChangeListener changeListener() {
    return changeListener;
  }

  public Optional<ErrorListener> errorListener() {
    return Optional.ofNullable(errorListener);
  }

  /**
   * Delivers a change to the change listener.
   *
   * @param event the change, never null
   */
  public void deliver(final ChangeEvent event) {
    try {
      changeListener.onChange(event);
    } catch (final Exception e) {
      log.error("Change listener threw exception for topic '{}'", key, e);
    }
  }

  /**
   * Reports an error to the error listener, if any.
   *
   * @param error the error, never null
   */
  public void reportError(final VigiaException error) {
    if (errorListener == null) {
      return;
    }
    try {
      errorListener.onError(error);
    } catch (final Exception e) {
      log.error("Error listener threw exception for topic '{}'", key, e);
    }
  }

  @Override
  public String toString() {
    return "Subscription[" + key + " -> " + resource + "]";
  }
}
