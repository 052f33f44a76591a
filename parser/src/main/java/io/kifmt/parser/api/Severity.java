package io.kifmt.parser.api;

/** Severity of a {@link Diagnostic}. */
public enum Severity {
  /** Something was tolerated or kept verbatim; the document is complete. */
  WARNING,
  /** An element could not be read and was dropped; its siblings are intact. */
  ERROR
}
