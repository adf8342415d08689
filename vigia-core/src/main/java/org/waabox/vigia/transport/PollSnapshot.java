package org.waabox.vigia.transport;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The rows a poll handle last observed for its topic.
 *
 * @param rows        the rows, never null
 * @param fingerprint the fingerprint of the rows, never null
 * @param observedAt  when the rows were observed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PollSnapshot(
    List<Map<String, Object>> rows,
    String fingerprint,
    Instant observedAt
) {

  /** Validates the components and freezes the row list. */
  public PollSnapshot {
    Objects.requireNonNull(rows, "rows cannot be null");
    Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
    Objects.requireNonNull(observedAt, "observedAt cannot be null");
    rows = List.copyOf(rows);
  }

  /**
   * Whether the given fingerprint describes the same rows as this
   * snapshot.
   *
   * @param otherFingerprint the fingerprint to compare, never null
   *
   * @return true if the rows are unchanged
   */
  public boolean sameAs(final String otherFingerprint) {
    return fingerprint.equals(otherFingerprint);
  }
}
