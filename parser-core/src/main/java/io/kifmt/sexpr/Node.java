package io.kifmt.sexpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * One parenthesized form of an S-expression: a token followed by inline scalar values and nested
 * child nodes. For example {@code (at 1.5 2 90)} is a node with token {@code at} and three
 * numeric values.
 *
 * <p>Nodes are immutable. Equality is structural: two nodes are equal iff their tokens, values and
 * children are recursively equal. Whitespace and number spelling do not matter.
 *
 * <p>The accessors return {@link Optional} variants so callers can keep "was it present" apart
 * from "what is the default":
 *
 * <pre>{@code
 * double width = node.child("width").flatMap(w -> w.numberValue(0)).orElse(0.0);
 * boolean hasAngle = node.child("at").map(at -> at.number(2).isPresent()).orElse(false);
 * }</pre>
 */
public final class Node {
  private final String token;
  private final List<ScalarValue> values;
  private final List<Node> children;
  private int hash;

  private Node(String token, List<ScalarValue> values, List<Node> children) {
    this.token = token;
    this.values = values;
    this.children = children;
  }

  /**
   * Creates a node from the given parts. The lists are copied.
   *
   * @param token the token name
   * @param values the inline values
   * @param children the child nodes
   * @return a new node
   */
  public static Node of(String token, List<? extends ScalarValue> values, List<Node> children) {
    return new Node(checkToken(token), List.copyOf(values), List.copyOf(children));
  }

  /**
   * Creates a new builder for a node with the given token.
   *
   * @param token the token name
   * @return a new builder
   */
  public static Builder builder(String token) {
    return new Builder(checkToken(token));
  }

  private static String checkToken(String token) {
    Objects.requireNonNull(token, "token");
    if (token.isEmpty()) {
      throw new IllegalArgumentException("Token cannot be empty");
    }
    return token;
  }

  public String token() {
    return token;
  }

  /** @return the inline values, unmodifiable */
  public List<ScalarValue> values() {
    return values;
  }

  /** @return the child nodes, unmodifiable */
  public List<Node> children() {
    return children;
  }

  public int valueCount() {
    return values.size();
  }

  public int childCount() {
    return children.size();
  }

  /**
   * Returns the first child with the given token.
   *
   * @param token the token to look for
   * @return the first matching child, if any
   */
  public Optional<Node> child(String token) {
    for (Node child : children) {
      if (child.token.equals(token)) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns all children with the given token, in source order.
   *
   * @param token the token to look for
   * @return the matching children
   */
  public List<Node> children(String token) {
    List<Node> result = new ArrayList<>();
    for (Node child : children) {
      if (child.token.equals(token)) {
        result.add(child);
      }
    }
    return result;
  }

  public boolean hasChild(String token) {
    return child(token).isPresent();
  }

  /**
   * Returns the value at the given index.
   *
   * @param index the value index
   * @return the value, or empty if the index is out of range
   */
  public Optional<ScalarValue> scalar(int index) {
    if (index < 0 || index >= values.size()) {
      return Optional.empty();
    }
    return Optional.of(values.get(index));
  }

  /**
   * Returns the text of a string or symbol value.
   *
   * @param index the value index
   * @return the text, or empty if absent or numeric
   */
  public Optional<String> string(int index) {
    return scalar(index)
        .filter(v -> !(v instanceof NumberValue))
        .map(ScalarValue::text);
  }

  /**
   * Returns the text of any value, including the literal of a number. Identifiers such as pad
   * numbers are sometimes written as bare numbers.
   *
   * @param index the value index
   * @return the text, or empty if absent
   */
  public Optional<String> text(int index) {
    return scalar(index).map(ScalarValue::text);
  }

  /**
   * Returns a numeric value.
   *
   * @param index the value index
   * @return the number, or empty if absent or not numeric
   */
  public OptionalDouble number(int index) {
    Optional<ScalarValue> v = scalar(index);
    if (v.isPresent() && v.get() instanceof NumberValue) {
      return OptionalDouble.of(((NumberValue) v.get()).value());
    }
    return OptionalDouble.empty();
  }

  /**
   * Boxed variant of {@link #number(int)}, convenient for {@code flatMap} chains.
   *
   * @param index the value index
   * @return the number, or empty if absent or not numeric
   */
  public Optional<Double> numberValue(int index) {
    OptionalDouble d = number(index);
    return d.isPresent() ? Optional.of(d.getAsDouble()) : Optional.empty();
  }

  /**
   * Returns a numeric value truncated to an int.
   *
   * @param index the value index
   * @return the integer, or empty if absent or not numeric
   */
  public OptionalInt integer(int index) {
    OptionalDouble d = number(index);
    return d.isPresent() ? OptionalInt.of((int) d.getAsDouble()) : OptionalInt.empty();
  }

  /**
   * Returns a {@code yes}/{@code no} symbol as a boolean.
   *
   * @param index the value index
   * @return the boolean, or empty if the value is absent or not {@code yes}/{@code no}
   */
  public Optional<Boolean> bool(int index) {
    Optional<ScalarValue> v = scalar(index);
    if (v.isPresent() && v.get() instanceof SymbolValue) {
      String s = v.get().text();
      if ("yes".equals(s)) {
        return Optional.of(Boolean.TRUE);
      } else if ("no".equals(s)) {
        return Optional.of(Boolean.FALSE);
      }
    }
    return Optional.empty();
  }

  /**
   * Checks whether a bare symbol appears among the values.
   *
   * @param symbol the symbol text
   * @return {@code true} if present
   */
  public boolean hasSymbol(String symbol) {
    for (ScalarValue v : values) {
      if (v instanceof SymbolValue && ((SymbolValue) v).value().equals(symbol)) {
        return true;
      }
    }
    return false;
  }

  public boolean isSymbol(int index) {
    return scalar(index).filter(v -> v instanceof SymbolValue).isPresent();
  }

  public boolean isQuoted(int index) {
    return scalar(index).filter(v -> v instanceof StringValue).isPresent();
  }

  /**
   * Returns a builder initialized with this node's content.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder b = new Builder(token);
    b.values.addAll(values);
    b.children.addAll(children);
    return b;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Node)) return false;
    Node other = (Node) o;
    return hashCode() == other.hashCode()
        && token.equals(other.token)
        && values.equals(other.values)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      h = Objects.hash(token, values, children);
      hash = h;
    }
    return h;
  }

  @Override
  public String toString() {
    return SExpressionWriter.canonical().write(this);
  }

  /** Fluent builder for {@link Node}. Not thread-safe. */
  public static final class Builder {
    private final String token;
    private final List<ScalarValue> values = new ArrayList<>();
    private final List<Node> children = new ArrayList<>();

    private Builder(String token) {
      this.token = token;
    }

    public Builder value(ScalarValue value) {
      values.add(Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder values(List<? extends ScalarValue> more) {
      more.forEach(this::value);
      return this;
    }

    /** Adds a quoted string. */
    public Builder string(String value) {
      return value(new StringValue(value));
    }

    /** Adds a bare symbol. */
    public Builder symbol(String value) {
      return value(new SymbolValue(value));
    }

    /** Adds a quoted string or a bare symbol. */
    public Builder text(String value, boolean bare) {
      return bare ? symbol(value) : string(value);
    }

    public Builder number(double value) {
      return value(NumberValue.of(value));
    }

    public Builder integer(long value) {
      return value(NumberValue.of(value));
    }

    /** Adds {@code yes} or {@code no}. */
    public Builder bool(boolean value) {
      return symbol(value ? "yes" : "no");
    }

    public Builder child(Node child) {
      children.add(Objects.requireNonNull(child, "child"));
      return this;
    }

    public Builder children(List<Node> more) {
      more.forEach(this::child);
      return this;
    }

    /**
     * Adds a child node configured by the given consumer.
     *
     * @param childToken the child's token
     * @param configure configures the child builder
     * @return this builder
     */
    public Builder child(String childToken, Consumer<Builder> configure) {
      Builder b = Node.builder(childToken);
      configure.accept(b);
      return child(b.build());
    }

    /** Adds a child node without values or children, such as {@code (power)}. */
    public Builder emptyChild(String childToken) {
      return child(Node.builder(childToken).build());
    }

    public String token() {
      return token;
    }

    public List<Node> currentChildren() {
      return Collections.unmodifiableList(children);
    }

    /** Removes all values, returning them in order. */
    public List<ScalarValue> drainValues() {
      List<ScalarValue> drained = new ArrayList<>(values);
      values.clear();
      return drained;
    }

    /** Removes all children, returning them in order. */
    public List<Node> drainChildren() {
      List<Node> drained = new ArrayList<>(children);
      children.clear();
      return drained;
    }

    public Node build() {
      return new Node(token, List.copyOf(values), List.copyOf(children));
    }
  }
}
