/**
 * Public API for reading and writing KiCad documents.
 *
 * <p>{@link io.kifmt.parser.api.KiCadFormat} is the entry point. Documents extend {@link
 * io.kifmt.parser.api.KiCadDocument} and carry the {@link io.kifmt.parser.api.Diagnostic}s found
 * while reading them. Fatal failures surface as {@link io.kifmt.parser.api.KiCadFileException}.
 *
 * <p>The entity packages hold the typed model: {@code api.model} for types shared by all
 * documents, {@code api.pcb} for footprints and boards, {@code api.sch} for schematics and {@code
 * api.symbol} for symbol libraries.
 */
package io.kifmt.parser.api;
