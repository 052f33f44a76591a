package io.kifmt.parser.api.model;

import java.util.Objects;
import java.util.UUID;

/**
 * An entity identifier together with its spelling: {@code (uuid "...")} in current files, {@code
 * (tstamp ...)} in older ones, quoted or bare.
 *
 * @param value the identifier text
 * @param token {@code uuid} or {@code tstamp}
 * @param bare whether the value was written without quotes
 */
public record UuidRef(String value, String token, boolean bare) {
  public static final String UUID = "uuid";
  public static final String TSTAMP = "tstamp";

  public UuidRef {
    Objects.requireNonNull(value, "value");
    if (!UUID.equals(token) && !TSTAMP.equals(token)) {
      throw new IllegalArgumentException("Not an identifier token: " + token);
    }
  }

  /** An identifier in the current spelling, {@code (uuid "value")}. */
  public static UuidRef of(String value) {
    return new UuidRef(value, UUID, false);
  }

  public static UuidRef random() {
    return of(java.util.UUID.randomUUID().toString());
  }

  public boolean isLegacy() {
    return TSTAMP.equals(token);
  }

  /** Returns an identifier with the same spelling and a new value. */
  public UuidRef withValue(String newValue) {
    return new UuidRef(newValue, token, bare);
  }

  @Override
  public String toString() {
    return value;
  }
}
