package io.kifmt.sexpr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Compares trees structurally with a numeric tolerance.
 *
 * <p>Two numbers match when they differ by no more than the tolerance, either absolutely or
 * relative to the larger magnitude. Everything else must be equal: tokens, value kinds, string
 * and symbol text, and the number and order of values and children.
 */
public final class NodeEquivalence {
  /** Tolerance used for round-trip comparisons. */
  public static final double DEFAULT_TOLERANCE = 5e-6;

  private NodeEquivalence() {}

  public static boolean equivalent(Node a, Node b) {
    return firstDifference(a, b, DEFAULT_TOLERANCE).isEmpty();
  }

  public static boolean equivalent(Node a, Node b, double tolerance) {
    return firstDifference(a, b, tolerance).isEmpty();
  }

  /**
   * Describes the first difference between two trees in depth-first order.
   *
   * @param a the expected tree
   * @param b the actual tree
   * @param tolerance the numeric tolerance
   * @return a description with the token path of the difference, or empty if equivalent
   */
  public static Optional<String> firstDifference(Node a, Node b, double tolerance) {
    Deque<Node[]> pending = new ArrayDeque<>();
    Deque<String> paths = new ArrayDeque<>();
    pending.push(new Node[] {a, b});
    paths.push(a.token());
    while (!pending.isEmpty()) {
      Node[] pair = pending.pop();
      String path = paths.pop();
      Node x = pair[0];
      Node y = pair[1];
      if (!x.token().equals(y.token())) {
        return Optional.of(path + ": token '" + x.token() + "' vs '" + y.token() + "'");
      }
      if (x.valueCount() != y.valueCount()) {
        return Optional.of(path + ": " + x.valueCount() + " values vs " + y.valueCount());
      }
      for (int i = 0; i < x.valueCount(); i++) {
        ScalarValue u = x.values().get(i);
        ScalarValue v = y.values().get(i);
        if (!valueMatches(u, v, tolerance)) {
          return Optional.of(path + ": value #" + i + " " + u + " vs " + v);
        }
      }
      if (x.childCount() != y.childCount()) {
        return Optional.of(path + ": " + x.childCount() + " children vs " + y.childCount());
      }
      for (int i = x.childCount() - 1; i >= 0; i--) {
        Node cx = x.children().get(i);
        pending.push(new Node[] {cx, y.children().get(i)});
        paths.push(path + "/" + cx.token() + "[" + i + "]");
      }
    }
    return Optional.empty();
  }

  private static boolean valueMatches(ScalarValue u, ScalarValue v, double tolerance) {
    if (u instanceof NumberValue && v instanceof NumberValue) {
      return numbersMatch(((NumberValue) u).value(), ((NumberValue) v).value(), tolerance);
    }
    return u.equals(v);
  }

  /**
   * Checks two numbers against the tolerance, absolute or relative.
   *
   * @param x the first number
   * @param y the second number
   * @param tolerance the tolerance
   * @return {@code true} if the numbers match
   */
  public static boolean numbersMatch(double x, double y, double tolerance) {
    double diff = Math.abs(x - y);
    if (diff <= tolerance) {
      return true;
    }
    return diff <= tolerance * Math.max(Math.abs(x), Math.abs(y));
  }
}
