package io.kifmt.sexpr;

/**
 * A scalar value inline in a {@link Node}, following the node's token.
 *
 * <p>The variant is closed: a value is either a {@link NumberValue}, a double-quoted {@link
 * StringValue} or a bare {@link SymbolValue}.
 */
public sealed interface ScalarValue permits NumberValue, StringValue, SymbolValue {

  /**
   * Returns the textual content of this value, without quotes or escapes.
   *
   * @return the text for strings and symbols, the formatted number for numbers
   */
  String text();

  /**
   * Creates a quoted string value.
   *
   * @param value the string content
   * @return a new string value
   */
  static ScalarValue string(String value) {
    return new StringValue(value);
  }

  /**
   * Creates a bare symbol value.
   *
   * @param value the symbol text
   * @return a new symbol value
   */
  static ScalarValue symbol(String value) {
    return new SymbolValue(value);
  }

  /**
   * Creates a numeric value without an original literal.
   *
   * @param value the number
   * @return a new number value
   */
  static ScalarValue number(double value) {
    return new NumberValue(value, null);
  }
}
