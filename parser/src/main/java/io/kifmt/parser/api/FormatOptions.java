package io.kifmt.parser.api;

import io.kifmt.sexpr.SExpressionWriter;

/**
 * Reader and writer settings.
 *
 * <p>{@link #defaults()} reads the following system properties:
 *
 * <ul>
 *   <li>{@code kifmt.writer.indent} - spaces per nesting level, default 2
 *   <li>{@code kifmt.writer.compact} - keep short leaf groups on one line, default {@code true}
 *   <li>{@code kifmt.writer.preserveNumberText} - write parsed numbers with their original
 *       literal, default {@code true}
 *   <li>{@code kifmt.reader.retainSourceTree} - keep the parsed tree on the document, default
 *       {@code false}
 * </ul>
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class FormatOptions {
  public static final String INDENT_PROPERTY = "kifmt.writer.indent";
  public static final String COMPACT_PROPERTY = "kifmt.writer.compact";
  public static final String PRESERVE_NUMBER_TEXT_PROPERTY = "kifmt.writer.preserveNumberText";
  public static final String RETAIN_SOURCE_TREE_PROPERTY = "kifmt.reader.retainSourceTree";

  private final int indent;
  private final boolean compact;
  private final boolean preserveNumberText;
  private final boolean retainSourceTree;

  private FormatOptions(
      int indent, boolean compact, boolean preserveNumberText, boolean retainSourceTree) {
    if (indent < 0 || indent > 8) {
      throw new IllegalArgumentException("Indent out of range: " + indent);
    }
    this.indent = indent;
    this.compact = compact;
    this.preserveNumberText = preserveNumberText;
    this.retainSourceTree = retainSourceTree;
  }

  /**
   * Returns options initialized from system properties.
   *
   * @return the options
   */
  public static FormatOptions defaults() {
    return new FormatOptions(
        Integer.getInteger(INDENT_PROPERTY, 2),
        booleanProperty(COMPACT_PROPERTY, true),
        booleanProperty(PRESERVE_NUMBER_TEXT_PROPERTY, true),
        Boolean.getBoolean(RETAIN_SOURCE_TREE_PROPERTY));
  }

  private static boolean booleanProperty(String name, boolean defaultValue) {
    String value = System.getProperty(name);
    return value == null ? defaultValue : Boolean.parseBoolean(value);
  }

  public int indent() {
    return indent;
  }

  public boolean compact() {
    return compact;
  }

  public boolean preserveNumberText() {
    return preserveNumberText;
  }

  public boolean retainSourceTree() {
    return retainSourceTree;
  }

  public FormatOptions withIndent(int indent) {
    return new FormatOptions(indent, compact, preserveNumberText, retainSourceTree);
  }

  public FormatOptions withCompact(boolean compact) {
    return new FormatOptions(indent, compact, preserveNumberText, retainSourceTree);
  }

  public FormatOptions withPreserveNumberText(boolean preserveNumberText) {
    return new FormatOptions(indent, compact, preserveNumberText, retainSourceTree);
  }

  public FormatOptions withRetainSourceTree(boolean retainSourceTree) {
    return new FormatOptions(indent, compact, preserveNumberText, retainSourceTree);
  }

  /** @return a tree writer configured with these options */
  public SExpressionWriter newWriter() {
    return SExpressionWriter.builder()
        .indentWidth(indent)
        .compact(compact)
        .preserveNumberText(preserveNumberText)
        .build();
  }

  @Override
  public String toString() {
    return "FormatOptions{indent="
        + indent
        + ", compact="
        + compact
        + ", preserveNumberText="
        + preserveNumberText
        + ", retainSourceTree="
        + retainSourceTree
        + '}';
  }
}
