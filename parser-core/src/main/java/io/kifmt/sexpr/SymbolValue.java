package io.kifmt.sexpr;

import java.util.Objects;

/**
 * An unquoted word such as {@code yes}, {@code smd} or {@code F.Cu}.
 *
 * @param value the symbol text
 */
public record SymbolValue(String value) implements ScalarValue {
  public SymbolValue {
    Objects.requireNonNull(value, "value");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("Symbol cannot be empty");
    }
  }

  @Override
  public String text() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
