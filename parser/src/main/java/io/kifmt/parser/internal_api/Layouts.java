package io.kifmt.parser.internal_api;

import io.kifmt.parser.api.model.Element;
import io.kifmt.sexpr.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Restores the child order an entity was read with. */
public final class Layouts {
  private Layouts() {}

  /**
   * Merges the typed children produced by a writer with the entity's raw children and puts them
   * in source order.
   *
   * <p>Children are matched to the recorded order token by token: the n-th child with a token
   * takes the place of the n-th occurrence of that token in the source. Typed and raw children
   * are matched separately, so a raw child returns to the exact place it was read from even when
   * typed siblings share its token. Children with no recorded
   * place, such as a field set after reading, go right after the last sibling with the same token,
   * or at the end. Without a recorded order the typed children come first, then the raw ones.
   *
   * @param element the entity being written
   * @param typed the children generated from its typed fields, in canonical order
   * @return all children in output order
   */
  public static List<Node> arrange(Element element, List<Node> typed) {
    List<Node> all = new ArrayList<>(typed.size() + element.getRawChildren().size());
    all.addAll(typed);
    all.addAll(element.getRawChildren());
    List<String> order = element.getSourceOrder();
    if (order.isEmpty()) {
      return all;
    }
    Map<String, Deque<Node>> byToken = queues(typed);
    Map<String, Deque<Node>> rawByToken = queues(element.getRawChildren());
    List<Node> result = new ArrayList<>(all.size());
    for (int i = 0; i < order.size(); i++) {
      String token = order.get(i);
      boolean raw = element.getRawPositions().contains(i);
      Node n = poll(raw ? rawByToken : byToken, token);
      if (n == null) {
        n = poll(raw ? byToken : rawByToken, token);
      }
      if (n != null) {
        result.add(n);
      }
    }
    for (Map.Entry<String, Deque<Node>> e : rawByToken.entrySet()) {
      byToken.computeIfAbsent(e.getKey(), k -> new ArrayDeque<>()).addAll(e.getValue());
    }
    for (Deque<Node> leftovers : byToken.values()) {
      while (!leftovers.isEmpty()) {
        Node n = leftovers.poll();
        int at = lastIndexOf(result, n.token());
        if (at < 0) {
          result.add(n);
        } else {
          result.add(at + 1, n);
        }
      }
    }
    return result;
  }

  private static Map<String, Deque<Node>> queues(List<Node> nodes) {
    Map<String, Deque<Node>> byToken = new LinkedHashMap<>();
    for (Node n : nodes) {
      byToken.computeIfAbsent(n.token(), k -> new ArrayDeque<>()).add(n);
    }
    return byToken;
  }

  private static Node poll(Map<String, Deque<Node>> byToken, String token) {
    Deque<Node> queue = byToken.get(token);
    return queue == null ? null : queue.poll();
  }

  private static int lastIndexOf(List<Node> nodes, String token) {
    for (int i = nodes.size() - 1; i >= 0; i--) {
      if (nodes.get(i).token().equals(token)) {
        return i;
      }
    }
    return -1;
  }
}
