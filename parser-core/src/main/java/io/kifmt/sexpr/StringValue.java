package io.kifmt.sexpr;

import java.util.Objects;

/**
 * A double-quoted string value.
 *
 * @param value the unescaped string content
 */
public record StringValue(String value) implements ScalarValue {
  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String text() {
    return value;
  }

  @Override
  public String toString() {
    return '"' + value + '"';
  }
}
