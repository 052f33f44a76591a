package io.kifmt.parser.impl;

import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;

/**
 * Turns a parsed tree into a document of one kind.
 *
 * @param <D> the document type
 */
@FunctionalInterface
public interface DocumentReader<D extends KiCadDocument> {
  /**
   * Reads the document. Problems below the root are recorded in the context, not thrown.
   *
   * @param root the root node
   * @param ctx the read context
   * @return the document
   * @throws KiCadFileException if the root token does not match the document kind
   */
  D read(Node root, ReadContext ctx) throws KiCadFileException;
}
