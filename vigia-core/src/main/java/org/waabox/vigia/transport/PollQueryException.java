package org.waabox.vigia.transport;

import java.util.Objects;

import org.waabox.vigia.VigiaException;

/**
 * Reported to a topic when one of its poll ticks fails. The poll timer
 * keeps running.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PollQueryException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** The topic key, never null. */
  private final String topicKey;

  /**
   * Creates a new exception.
   *
   * @param theTopicKey the topic key, never null
   * @param message     the detail message, never null
   * @param cause       the underlying cause, may be null
   */
  public PollQueryException(final String theTopicKey, final String message,
      final Throwable cause) {
    super("Topic '" + theTopicKey + "': " + message, cause);
    topicKey = Objects.requireNonNull(theTopicKey,
        "topicKey cannot be null");
  }

  public String topicKey() {
    return topicKey;
  }
}
