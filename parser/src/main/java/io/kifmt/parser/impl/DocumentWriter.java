package io.kifmt.parser.impl;

import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.sexpr.Node;

/**
 * Turns a document back into a tree.
 *
 * @param <D> the document type
 */
@FunctionalInterface
public interface DocumentWriter<D extends KiCadDocument> {
  Node write(D document);
}
