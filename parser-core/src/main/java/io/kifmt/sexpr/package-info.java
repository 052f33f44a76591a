/**
 * The S-expression tree engine: immutable {@link io.kifmt.sexpr.Node} trees, the {@link
 * io.kifmt.sexpr.SExpressionParser} that builds them from text and the {@link
 * io.kifmt.sexpr.SExpressionWriter} that turns them back into text.
 *
 * <p>Nothing in this package knows about KiCad; it is the syntax layer every document reader and
 * writer builds on.
 *
 * <pre>{@code
 * Node root = SExpressionParser.parse("(footprint \"R\" (layer \"F.Cu\"))");
 * String layer = root.child("layer").flatMap(l -> l.string(0)).orElse(null);
 * String text = SExpressionWriter.canonical().write(root);
 * }</pre>
 */
package io.kifmt.sexpr;
