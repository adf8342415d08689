package org.waabox.vigia.transport;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Computes a value-based fingerprint of a poll result.
 *
 * <p>The rows are written as canonical JSON (map entries sorted by key,
 * dates as ISO-8601 text) and hashed with SHA-256. Two results with the
 * same rows in the same order have the same fingerprint, regardless of
 * the map implementation or key order of each row.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RowsFingerprint {

  /** Writes the canonical JSON form of the rows. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
      .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
      .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private RowsFingerprint() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the fingerprint of the given rows.
   *
   * @param rows the rows, never null
   *
   * @return the lowercase hex SHA-256 of the canonical JSON, never null
   *
   * @throws IllegalArgumentException if a value cannot be serialized
   */
  public static String of(final List<Map<String, Object>> rows) {
    Objects.requireNonNull(rows, "rows cannot be null");
    final byte[] json;
    try {
      json = MAPPER.writeValueAsBytes(rows);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Cannot serialize rows for fingerprinting", e);
    }
    return toHex(sha256().digest(json));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private static String toHex(final byte[] bytes) {
    final StringBuilder sb = new StringBuilder(bytes.length * 2);
    for (final byte b : bytes) {
      sb.append(String.format("%02x", b));
    }
    return sb.toString();
  }
}
