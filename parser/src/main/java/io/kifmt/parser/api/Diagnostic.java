package io.kifmt.parser.api;

import java.util.Objects;

/**
 * A non-fatal problem found while reading a document.
 *
 * <p>Diagnostics are part of the document's state, in the order they were found.
 *
 * @param severity the severity
 * @param message a human readable description
 * @param context where the problem was found, such as {@code footprint "R1" > pad "3"}; may be
 *     empty
 */
public record Diagnostic(Severity severity, String message, String context) {
  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    context = context == null ? "" : context;
  }

  public static Diagnostic warning(String message, String context) {
    return new Diagnostic(Severity.WARNING, message, context);
  }

  public static Diagnostic error(String message, String context) {
    return new Diagnostic(Severity.ERROR, message, context);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + ": " + message + (context.isEmpty() ? "" : " (" + context + ")");
  }
}
