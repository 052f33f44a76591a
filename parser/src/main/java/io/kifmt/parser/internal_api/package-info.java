/**
 * Building blocks shared by the document readers and writers. Not part of the public API.
 *
 * <p>Readers walk a node with a {@link io.kifmt.parser.internal_api.NodeCursor}, which tracks
 * what was consumed so the rest can be kept verbatim. Writers emit typed fields through {@link
 * io.kifmt.parser.internal_api.Encoders} and put children back in source order with {@link
 * io.kifmt.parser.internal_api.Layouts}.
 */
package io.kifmt.parser.internal_api;
