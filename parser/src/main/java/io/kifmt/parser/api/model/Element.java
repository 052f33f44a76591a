package io.kifmt.parser.api.model;

import io.kifmt.sexpr.Node;
import io.kifmt.sexpr.ScalarValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base of every entity in the document model.
 *
 * <p>Besides its typed fields an entity remembers how it was written, so that writing it back
 * reproduces the source:
 *
 * <ul>
 *   <li>{@link #getSourceOrder()} - the tokens of its child nodes, in the order they were read.
 *       Writers arrange children back into this order.
 *   <li>{@link #getRawChildren()} - child nodes that were not turned into typed fields. They are
 *       written back verbatim, at the places {@link #getRawPositions()} records.
 *   <li>{@link #getRawValues()} - inline values that were not turned into typed fields.
 *   <li>{@link #getBareKeys()} - which text fields were written as bare words rather than quoted
 *       strings. A key is a child token such as {@code layer}, {@code @i} for the entity's own
 *       value at index {@code i}, or {@link #valueKey(String, int)} for a later value of a child.
 *   <li>{@link #getWordOrder()} - the bare flag and type words among the entity's own values,
 *       such as {@code placed locked}, in the order they were read.
 *   <li>{@link #getShortForms()} - child tokens read in an older, shorter spelling, such as a
 *       {@code color} without alpha.
 * </ul>
 *
 * <p>All of them are empty for entities created in code, which are written in the current KiCad
 * layout.
 */
public abstract class Element {
  private final List<String> sourceOrder = new ArrayList<>();
  private final List<Node> rawChildren = new ArrayList<>();
  private final Set<Integer> rawPositions = new HashSet<>();
  private final List<ScalarValue> rawValues = new ArrayList<>();
  private final Set<String> bareKeys = new LinkedHashSet<>();
  private final List<String> wordOrder = new ArrayList<>();
  private final Set<String> shortForms = new LinkedHashSet<>();

  /**
   * @param token a child token
   * @param index a value index of that child
   * @return the bare key of the value: the token itself for the first value, {@code token@i}
   *     for the others
   */
  public static String valueKey(String token, int index) {
    return index == 0 ? token : token + "@" + index;
  }

  /** @return the child tokens in read order, mutable */
  public List<String> getSourceOrder() {
    return sourceOrder;
  }

  /** @return the unmodeled child nodes, mutable */
  public List<Node> getRawChildren() {
    return rawChildren;
  }

  /** @return the indexes into {@link #getSourceOrder()} of children kept raw, mutable */
  public Set<Integer> getRawPositions() {
    return rawPositions;
  }

  /** @return the unmodeled inline values, mutable */
  public List<ScalarValue> getRawValues() {
    return rawValues;
  }

  /** @return keys of text fields that were written bare, mutable */
  public Set<String> getBareKeys() {
    return bareKeys;
  }

  public boolean isBare(String key) {
    return bareKeys.contains(key);
  }

  /** @return the flag and type words in read order, mutable */
  public List<String> getWordOrder() {
    return wordOrder;
  }

  /** @return tokens of children read in a short legacy spelling, mutable */
  public Set<String> getShortForms() {
    return shortForms;
  }

  public boolean isShortForm(String token) {
    return shortForms.contains(token);
  }

  /**
   * @param token a child token
   * @return whether the source had a child with the token that was read into a typed field
   */
  public boolean hadTypedChild(String token) {
    return sourceOrder.contains(token)
        && rawChildren.stream().noneMatch(n -> n.token().equals(token));
  }

  /** Forgets the source layout, so the entity is written like a new one. */
  public void clearSourceLayout() {
    sourceOrder.clear();
    rawPositions.clear();
    bareKeys.clear();
    wordOrder.clear();
    shortForms.clear();
  }
}
