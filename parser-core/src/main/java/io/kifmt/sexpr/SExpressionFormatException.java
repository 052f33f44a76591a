package io.kifmt.sexpr;

/**
 * Thrown when text is not a well-formed S-expression: unbalanced parentheses, an unterminated
 * string, a missing token after {@code (} or trailing content after the root form.
 */
public class SExpressionFormatException extends Exception {
  private final int offset;
  private final int line;
  private final int column;

  /**
   * Constructs a new exception.
   *
   * @param message the detail message
   * @param offset the character offset of the offending position
   * @param line the 1-based line of the offending position
   * @param column the 1-based column of the offending position
   */
  public SExpressionFormatException(String message, int offset, int line, int column) {
    super(message + " at line " + line + ", column " + column);
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public int getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
