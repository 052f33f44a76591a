package io.kifmt.sexpr;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Node} tree back into text.
 *
 * <p>Output is deterministic and pretty-printed in the layout KiCad uses itself. Each child sits
 * on its own line, indented by depth. Strings are quoted and escaped, symbols are written bare.
 * Numbers use their source literal when one is available, otherwise {@link
 * NumberValue#format(double)}. Short groups of leaf children such as {@code (stroke (width 0.1)
 * (type solid))} are kept on one line.
 *
 * <p>The writer never reorders values or children. Instances are immutable and thread-safe.
 */
public final class SExpressionWriter {
  private static final int COMPACT_LIMIT = 80;
  private static final SExpressionWriter CANONICAL = builder().build();

  private final int indentWidth;
  private final boolean compact;
  private final boolean preserveNumberText;

  private SExpressionWriter(Builder builder) {
    this.indentWidth = builder.indentWidth;
    this.compact = builder.compact;
    this.preserveNumberText = builder.preserveNumberText;
  }

  /** @return a writer with default settings */
  public static SExpressionWriter canonical() {
    return CANONICAL;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Writes the node to a string.
   *
   * @param root the node to write
   * @return the formatted text, without a trailing newline
   */
  public String write(Node root) {
    StringBuilder sb = new StringBuilder(4096);
    try {
      write(root, sb);
    } catch (IOException e) {
      // StringBuilder does not throw
      throw new UncheckedIOException(e);
    }
    return sb.toString();
  }

  /**
   * Writes the node to the given appendable.
   *
   * @param root the node to write
   * @param out the destination
   * @throws IOException if the destination fails
   */
  public void write(Node root, Appendable out) throws IOException {
    List<Frame> stack = new ArrayList<>();
    stack.add(new Frame(root, 0));
    while (!stack.isEmpty()) {
      Frame frame = stack.get(stack.size() - 1);
      Node node = frame.node;
      if (frame.next == 0 && !frame.opened) {
        frame.opened = true;
        out.append('(').append(node.token());
        for (ScalarValue value : node.values()) {
          out.append(' ');
          writeValue(value, out);
        }
        if (node.childCount() == 0) {
          out.append(')');
          stack.remove(stack.size() - 1);
          continue;
        }
        frame.compact = compact && isCompact(node);
      }
      if (frame.next < node.childCount()) {
        Node child = node.children().get(frame.next++);
        if (frame.compact) {
          out.append(' ');
        } else {
          out.append('\n');
          indent(out, frame.depth + 1);
        }
        stack.add(new Frame(child, frame.depth + 1));
      } else {
        if (!frame.compact) {
          out.append('\n');
          indent(out, frame.depth);
        }
        out.append(')');
        stack.remove(stack.size() - 1);
      }
    }
  }

  private void indent(Appendable out, int depth) throws IOException {
    for (int i = 0, n = depth * indentWidth; i < n; i++) {
      out.append(' ');
    }
  }

  private boolean isCompact(Node node) {
    if (node.valueCount() > 0 || node.childCount() > 2) {
      return false;
    }
    int length = node.token().length();
    for (Node child : node.children()) {
      if (child.childCount() > 0) {
        return false;
      }
      length += 2 + child.token().length();
      for (ScalarValue v : child.values()) {
        length += 1 + valueText(v).length() + (v instanceof StringValue ? 2 : 0);
      }
    }
    return length < COMPACT_LIMIT;
  }

  private String valueText(ScalarValue value) {
    if (value instanceof NumberValue) {
      NumberValue n = (NumberValue) value;
      return preserveNumberText && n.literal() != null
          ? n.literal()
          : NumberValue.format(n.value());
    }
    return value.text();
  }

  private void writeValue(ScalarValue value, Appendable out) throws IOException {
    if (value instanceof StringValue) {
      writeQuoted(((StringValue) value).value(), out);
    } else {
      out.append(valueText(value));
    }
  }

  /**
   * Appends a quoted, escaped string.
   *
   * @param s the raw string
   * @param out the destination
   * @throws IOException if the destination fails
   */
  static void writeQuoted(String s, Appendable out) throws IOException {
    out.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> out.append(c);
      }
    }
    out.append('"');
  }

  private static final class Frame {
    final Node node;
    final int depth;
    int next;
    boolean opened;
    boolean compact;

    Frame(Node node, int depth) {
      this.node = node;
      this.depth = depth;
    }
  }

  /** Builder for {@link SExpressionWriter}. */
  public static final class Builder {
    private int indentWidth = 2;
    private boolean compact = true;
    private boolean preserveNumberText = true;

    private Builder() {}

    /**
     * Sets the number of spaces per nesting level.
     *
     * @param width the indent width, 0 to 8
     * @return this builder
     */
    public Builder indentWidth(int width) {
      if (width < 0 || width > 8) {
        throw new IllegalArgumentException("Indent width out of range: " + width);
      }
      this.indentWidth = width;
      return this;
    }

    /** Whether short groups of leaf children are kept on one line. */
    public Builder compact(boolean compact) {
      this.compact = compact;
      return this;
    }

    /** Whether parsed numbers are written with their original literal. */
    public Builder preserveNumberText(boolean preserve) {
      this.preserveNumberText = preserve;
      return this;
    }

    public SExpressionWriter build() {
      return new SExpressionWriter(this);
    }
  }
}
