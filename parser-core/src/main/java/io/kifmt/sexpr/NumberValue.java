package io.kifmt.sexpr;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A numeric value.
 *
 * <p>The literal the number was parsed from is kept in {@link #literal()} so an unchanged number
 * can be written back exactly as it appeared. The literal does not take part in equality: {@code
 * 1.0} and {@code 1} are the same value.
 *
 * @param value the numeric value
 * @param literal the source literal, or {@code null} for numbers created in code
 */
public record NumberValue(double value, String literal) implements ScalarValue {
  /** Maximum number of decimals emitted for numbers without a literal. */
  public static final int MAX_DECIMALS = 6;

  public NumberValue {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("Not a finite number: " + value);
    }
  }

  /**
   * Creates a number without a source literal.
   *
   * @param value the numeric value
   * @return a new number value
   */
  public static NumberValue of(double value) {
    return new NumberValue(value, null);
  }

  /**
   * Returns the value truncated to an int.
   *
   * @return the integral part of the value
   */
  public int intValue() {
    return (int) value;
  }

  @Override
  public String text() {
    return literal != null ? literal : format(value);
  }

  /**
   * Formats a number the way KiCad writes it: plain notation, at most {@value #MAX_DECIMALS}
   * decimals, no trailing zeros and no negative zero.
   *
   * @param value the value to format
   * @return the formatted number
   */
  public static String format(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      long l = (long) value;
      return Long.toString(l);
    }
    BigDecimal bd = new BigDecimal(value).setScale(MAX_DECIMALS, RoundingMode.HALF_EVEN);
    if (bd.signum() == 0) {
      return "0";
    }
    String s = bd.stripTrailingZeros().toPlainString();
    return s;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NumberValue)) return false;
    return Double.compare(value, ((NumberValue) o).value) == 0
        || (value == 0 && ((NumberValue) o).value == 0);
  }

  @Override
  public int hashCode() {
    return value == 0 ? 0 : Double.hashCode(value);
  }

  @Override
  public String toString() {
    return text();
  }
}
