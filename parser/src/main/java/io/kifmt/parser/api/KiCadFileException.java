package io.kifmt.parser.api;

import io.kifmt.sexpr.SExpressionFormatException;
import java.io.IOException;
import java.util.Collection;

/**
 * Fatal failure to read or write a KiCad document.
 *
 * <p>Carries the source (a path or a stream description) as context, an error code naming the
 * failure class and, for syntax errors, the line and column.
 */
public class KiCadFileException extends Exception {
  public static final String SYNTAX = "SYNTAX";
  public static final String ROOT = "ROOT";
  public static final String IO = "IO";
  public static final String CANCELLED = "CANCELLED";
  public static final String UNSUPPORTED = "UNSUPPORTED";

  private final String context;
  private final String errorCode;
  private final int line;
  private final int column;

  public KiCadFileException(String message, String context, String errorCode) {
    this(message, null, context, errorCode, -1, -1);
  }

  public KiCadFileException(String message, Throwable cause, String context, String errorCode) {
    this(message, cause, context, errorCode, -1, -1);
  }

  private KiCadFileException(
      String message, Throwable cause, String context, String errorCode, int line, int column) {
    super(formatMessage(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
    this.line = line;
    this.column = column;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  /**
   * Creates an exception for text that is not a well-formed S-expression.
   *
   * @param source the path or stream the text came from
   * @param cause the parser failure, which carries the position
   * @return a new exception with code {@value #SYNTAX}
   */
  public static KiCadFileException syntax(String source, SExpressionFormatException cause) {
    return new KiCadFileException(
        "Malformed S-expression: " + cause.getMessage(),
        cause,
        source,
        SYNTAX,
        cause.getLine(),
        cause.getColumn());
  }

  /**
   * Creates an exception for a document whose root token is not the expected one.
   *
   * @param source the path or stream the document came from
   * @param expected the accepted root tokens
   * @param actual the root token found
   * @return a new exception with code {@value #ROOT}
   */
  public static KiCadFileException wrongRoot(
      String source, Collection<String> expected, String actual) {
    return new KiCadFileException(
        "Unexpected root token '" + actual + "', expected " + String.join(" or ", expected),
        source,
        ROOT);
  }

  /**
   * Creates an exception for a well-formed tree whose root node lacks what the document kind
   * requires, such as a footprint without a name.
   *
   * @param source the path or stream the document came from
   * @param cause the failure raised while reading the root node
   * @return a new exception with code {@value #SYNTAX}
   */
  public static KiCadFileException malformedRoot(String source, RuntimeException cause) {
    return new KiCadFileException(
        "Malformed document root: " + cause.getMessage(), cause, source, SYNTAX);
  }

  /**
   * Creates an exception for an I/O failure.
   *
   * @param source the path or stream being read or written
   * @param cause the underlying failure
   * @return a new exception with code {@value #IO}
   */
  public static KiCadFileException io(String source, IOException cause) {
    return new KiCadFileException("I/O failure: " + cause.getMessage(), cause, source, IO);
  }

  /**
   * Creates an exception for an operation stopped by its {@link CancellationToken}.
   *
   * @param source the path or stream being read or written
   * @return a new exception with code {@value #CANCELLED}
   */
  public static KiCadFileException cancelled(String source) {
    return new KiCadFileException("Operation cancelled", source, CANCELLED);
  }

  /**
   * Creates an exception for a request the library cannot serve, such as an unknown file
   * extension.
   *
   * @param message what is not supported
   * @param context the offending input
   * @return a new exception with code {@value #UNSUPPORTED}
   */
  public static KiCadFileException unsupported(String message, String context) {
    return new KiCadFileException(message, context, UNSUPPORTED);
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }

  /** @return the 1-based line of a syntax error, or -1 */
  public int getLine() {
    return line;
  }

  /** @return the 1-based column of a syntax error, or -1 */
  public int getColumn() {
    return column;
  }
}
