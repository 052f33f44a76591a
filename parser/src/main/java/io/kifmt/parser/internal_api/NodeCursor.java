package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Point;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.UuidRef;
import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.NumberValue;
import io.kifmt.sexpr.ScalarValue;
import io.kifmt.sexpr.StringValue;
import io.kifmt.sexpr.SymbolValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Reads the parts of one node while tracking which values and children were used.
 *
 * <p>Every accessor marks what it returns as consumed. {@link #finish(Element, Set)} then stores
 * everything left over on the entity as raw values and raw children, and records the order of
 * the children, so that nothing read is lost when the entity is written back.
 *
 * <p>Shape-sensitive accessors such as {@link #childText(String)} only consume a child whose shape
 * they fully understand. A child with unexpected extra content is left in place and ends up raw.
 * Geometry accessors are strict instead: a malformed {@code (at ...)} or {@code (start ...)}
 * throws {@link ElementFormatException}.
 */
public final class NodeCursor {
  private final Node node;
  private final ReadContext ctx;
  private final boolean[] usedValues;
  private final boolean[] usedChildren;
  private final boolean[] words;
  private final Set<String> attempted = new HashSet<>();
  private final Set<String> bare = new LinkedHashSet<>();

  private NodeCursor(Node node, ReadContext ctx) {
    this.node = node;
    this.ctx = ctx;
    this.usedValues = new boolean[node.valueCount()];
    this.usedChildren = new boolean[node.childCount()];
    this.words = new boolean[node.valueCount()];
  }

  public static NodeCursor of(Node node, ReadContext ctx) {
    return new NodeCursor(node, ctx);
  }

  public Node node() {
    return node;
  }

  public String token() {
    return node.token();
  }

  public ReadContext context() {
    return ctx;
  }

  // ---- inline values

  /**
   * Takes the value at an index.
   *
   * @param index the value index
   * @return the value, or empty if absent or already taken
   */
  public Optional<ScalarValue> value(int index) {
    if (index < 0 || index >= usedValues.length || usedValues[index]) {
      return Optional.empty();
    }
    usedValues[index] = true;
    return Optional.of(node.values().get(index));
  }

  /**
   * Takes the text of the value at an index. A bare value is remembered under the key {@code
   * @index}.
   *
   * @param index the value index
   * @return the text of a string, symbol or number literal
   */
  public Optional<String> text(int index) {
    if (index < 0 || index >= usedValues.length || usedValues[index]) {
      return Optional.empty();
    }
    ScalarValue v = node.values().get(index);
    usedValues[index] = true;
    if (!(v instanceof StringValue)) {
      bare.add("@" + index);
    }
    return Optional.of(v.text());
  }

  /**
   * Like {@link #text(int)} but fails when the value is missing.
   *
   * @param index the value index
   * @param what a description for the error message
   * @return the text
   * @throws ElementFormatException if the value is absent
   */
  public String requireText(int index, String what) {
    return text(index)
        .orElseThrow(() -> new ElementFormatException("Missing " + what + " in " + token()));
  }

  /** Takes the value at an index if it is a bare symbol. */
  public Optional<String> symbol(int index) {
    if (index < 0 || index >= usedValues.length || usedValues[index]) {
      return Optional.empty();
    }
    ScalarValue v = node.values().get(index);
    if (!(v instanceof SymbolValue)) {
      return Optional.empty();
    }
    usedValues[index] = true;
    return Optional.of(v.text());
  }

  /** Takes the value at an index if it is a number. */
  public Optional<Double> number(int index) {
    if (index < 0 || index >= usedValues.length || usedValues[index]) {
      return Optional.empty();
    }
    ScalarValue v = node.values().get(index);
    if (!(v instanceof NumberValue)) {
      return Optional.empty();
    }
    usedValues[index] = true;
    return Optional.of(((NumberValue) v).value());
  }

  /**
   * Takes the first unused bare symbol equal to the given word.
   *
   * @param word the word
   * @return whether it was found
   */
  public boolean takeSymbol(String word) {
    for (int i = 0; i < usedValues.length; i++) {
      ScalarValue v = node.values().get(i);
      if (!usedValues[i] && v instanceof SymbolValue && ((SymbolValue) v).value().equals(word)) {
        usedValues[i] = true;
        words[i] = true;
        return true;
      }
    }
    return false;
  }

  // ---- children

  public int childCount() {
    return usedChildren.length;
  }

  public Node childAt(int index) {
    return node.children().get(index);
  }

  public boolean isUsed(int childIndex) {
    return usedChildren[childIndex];
  }

  public void use(int childIndex) {
    usedChildren[childIndex] = true;
  }

  /** Takes the first unused child with the token. */
  public Optional<Node> child(String childToken) {
    return childIf(childToken, n -> true);
  }

  /**
   * Takes the first unused child with the token, if it passes the check. A child that fails the
   * check stays unused.
   *
   * @param childToken the token
   * @param accept the shape check
   * @return the child, if present and accepted
   */
  public Optional<Node> childIf(String childToken, Predicate<Node> accept) {
    attempted.add(childToken);
    for (int i = 0; i < usedChildren.length; i++) {
      Node c = node.children().get(i);
      if (!usedChildren[i] && c.token().equals(childToken)) {
        if (!accept.test(c)) {
          return Optional.empty();
        }
        usedChildren[i] = true;
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  /** Takes all unused children with the token, in order. */
  public List<Node> children(String childToken) {
    attempted.add(childToken);
    List<Node> result = new ArrayList<>();
    for (int i = 0; i < usedChildren.length; i++) {
      Node c = node.children().get(i);
      if (!usedChildren[i] && c.token().equals(childToken)) {
        usedChildren[i] = true;
        result.add(c);
      }
    }
    return result;
  }

  private static boolean isSingleValue(Node n) {
    return n.valueCount() == 1 && n.childCount() == 0;
  }

  private static boolean isSingleNumber(Node n) {
    return isSingleValue(n) && n.values().get(0) instanceof NumberValue;
  }

  /**
   * Takes {@code (token "text")}. A bare value is remembered under the child token.
   *
   * @param childToken the token
   * @return the text, if the child is present with exactly one value
   */
  public Optional<String> childText(String childToken) {
    Optional<Node> c = childIf(childToken, NodeCursor::isSingleValue);
    if (c.isEmpty()) {
      return Optional.empty();
    }
    if (!c.get().isQuoted(0)) {
      bare.add(childToken);
    }
    return c.get().text(0);
  }

  /**
   * Takes {@code (token "a" "b" ...)} as a list of texts. Bare values are remembered under
   * {@link Element#valueKey(String, int)}.
   *
   * @param childToken the token
   * @return the texts, if the child is present without nested children
   */
  public Optional<List<String>> childTexts(String childToken) {
    Optional<Node> c = childIf(childToken, n -> n.childCount() == 0);
    if (c.isEmpty()) {
      return Optional.empty();
    }
    List<String> texts = new ArrayList<>();
    for (int i = 0; i < c.get().valueCount(); i++) {
      texts.add(c.get().values().get(i).text());
      if (!c.get().isQuoted(i)) {
        bare.add(Element.valueKey(childToken, i));
      }
    }
    return Optional.of(texts);
  }

  public Optional<Double> childNumber(String childToken) {
    return childIf(childToken, NodeCursor::isSingleNumber)
        .map(c -> ((NumberValue) c.values().get(0)).value());
  }

  public Optional<Integer> childInt(String childToken) {
    return childIf(
            childToken,
            n -> isSingleNumber(n) && ((NumberValue) n.values().get(0)).value() % 1 == 0)
        .map(c -> ((NumberValue) c.values().get(0)).intValue());
  }

  public Optional<Coord> childCoord(String childToken) {
    return childNumber(childToken).map(Coord::fromMm);
  }

  /** Takes {@code (token yes|no)}. */
  public Optional<Boolean> childBool(String childToken) {
    return childIf(childToken, n -> isSingleValue(n) && n.bool(0).isPresent())
        .flatMap(c -> c.bool(0));
  }

  /**
   * Takes a flag in any of its spellings: a bare word among the values, {@code (word yes|no)} or
   * {@code (word)}.
   *
   * @param word the flag word
   * @return the flag, or null if absent
   */
  public Flag flag(String word) {
    if (takeSymbol(word)) {
      return new Flag(true, Flag.Form.SYMBOL);
    }
    Optional<Node> c =
        childIf(
            word,
            n ->
                n.childCount() == 0
                    && (n.valueCount() == 0 || (n.valueCount() == 1 && n.bool(0).isPresent())));
    if (c.isEmpty()) {
      return null;
    }
    if (c.get().valueCount() == 0) {
      return new Flag(true, Flag.Form.MARKER);
    }
    return new Flag(c.get().bool(0).get(), Flag.Form.CHILD);
  }

  /**
   * Takes {@code (token x y)}.
   *
   * @param childToken the token, such as {@code start} or {@code xy}
   * @return the point, if present
   * @throws ElementFormatException if the child is not two numbers
   */
  public Optional<Point> point(String childToken) {
    Optional<Node> c = child(childToken);
    return c.map(Decoders::point);
  }

  public Point requirePoint(String childToken) {
    return point(childToken)
        .orElseThrow(
            () -> new ElementFormatException("Missing (" + childToken + ") in " + token()));
  }

  /**
   * Takes {@code (at x y [angle])}.
   *
   * @return the position, if present
   * @throws ElementFormatException if the position is malformed
   */
  public Optional<Position> position() {
    return child("at").map(Decoders::position);
  }

  /**
   * Takes {@code (at x y)} for entities placed without rotation. An {@code at} with more values
   * is left in place.
   */
  public Optional<Point> atPoint() {
    return childIf("at", n -> n.valueCount() == 2).map(Decoders::point);
  }

  /** Remembers that a text field was written bare. */
  public void markBare(String key) {
    bare.add(key);
  }

  /**
   * Takes the text of the first unused value.
   *
   * @return the text, or empty if every value was used
   */
  public Optional<String> nextText() {
    for (int i = 0; i < usedValues.length; i++) {
      if (!usedValues[i]) {
        return text(i);
      }
    }
    return Optional.empty();
  }

  /** Takes {@code (uuid ...)} or the legacy {@code (tstamp ...)}. */
  public Optional<UuidRef> uuid() {
    Optional<Node> c = childIf(UuidRef.UUID, NodeCursor::isSingleValue);
    if (c.isEmpty()) {
      c = childIf(UuidRef.TSTAMP, NodeCursor::isSingleValue);
    }
    return c.map(n -> new UuidRef(n.text(0).get(), n.token(), !n.isQuoted(0)));
  }

  /**
   * Stores everything not consumed on the entity and records the child order.
   *
   * <p>Leftover children produce a warning unless their token is in {@code silent}.
   *
   * @param target the entity read from this node
   * @param silent tokens kept raw without a warning
   */
  public void finish(Element target, Set<String> silent) {
    for (int i = 0; i < usedChildren.length; i++) {
      Node c = node.children().get(i);
      int slot = target.getSourceOrder().size();
      target.getSourceOrder().add(c.token());
      if (!usedChildren[i]) {
        target.getRawPositions().add(slot);
        target.getRawChildren().add(c);
        if (!silent.contains(c.token())) {
          if (attempted.contains(c.token())) {
            ctx.warn("Unsupported form of '" + c.token() + "' in " + token() + " kept verbatim");
          } else {
            ctx.warn("Unknown token '" + c.token() + "' in " + token() + " kept verbatim");
          }
        }
      }
    }
    for (int i = 0; i < usedValues.length; i++) {
      if (!usedValues[i]) {
        target.getRawValues().add(node.values().get(i));
      } else if (words[i]) {
        target.getWordOrder().add(node.values().get(i).text());
      }
    }
    target.getBareKeys().addAll(bare);
  }

  /** Same as {@link #finish(Element, Set)} with no silent tokens. */
  public void finish(Element target) {
    finish(target, Set.of());
  }
}
