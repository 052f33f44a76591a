package io.kifmt.parser.internal_api;

/**
 * Thrown by element readers when a node cannot be turned into its entity. The dispatcher catches
 * it, records an error diagnostic and drops the element.
 */
public class ElementFormatException extends RuntimeException {
  public ElementFormatException(String message) {
    super(message);
  }

  public ElementFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
