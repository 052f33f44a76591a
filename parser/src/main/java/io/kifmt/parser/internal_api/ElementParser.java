package io.kifmt.parser.internal_api;

import io.kifmt.sexpr.Node;

/**
 * Reads one node into an entity.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface ElementParser<T> {
  /**
   * Reads the node.
   *
   * @param node the node, whose token selected this parser
   * @param ctx the read context collecting diagnostics
   * @return the entity, never null
   * @throws RuntimeException if the node is malformed; the caller drops the element
   */
  T parse(Node node, ReadContext ctx);
}
