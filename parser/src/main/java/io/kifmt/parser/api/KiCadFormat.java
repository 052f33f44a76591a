package io.kifmt.parser.api;

import io.kifmt.parser.api.pcb.Board;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.sch.Schematic;
import io.kifmt.parser.api.symbol.SymbolLibrary;
import io.kifmt.parser.impl.KiCadFormatImpl;
import io.kifmt.parser.impl.pcb.BoardReader;
import io.kifmt.parser.impl.pcb.BoardWriter;
import io.kifmt.parser.impl.pcb.FootprintReader;
import io.kifmt.parser.impl.pcb.FootprintWriter;
import io.kifmt.parser.impl.sch.SchematicReader;
import io.kifmt.parser.impl.sch.SchematicWriter;
import io.kifmt.parser.impl.symbol.SymbolLibraryReader;
import io.kifmt.parser.impl.symbol.SymbolLibraryWriter;
import io.kifmt.sexpr.Node;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Entry point for reading and writing one kind of KiCad document.
 *
 * <p>Obtain a format with {@link #board()}, {@link #footprint()}, {@link #schematic()} or {@link
 * #symbolLibrary()}, or pick one by file extension with {@link #detect(Path)}. Formats are
 * stateless and may be shared between threads; every call reads or writes one document.
 *
 * <pre>{@code
 * Footprint fp = KiCadFormat.footprint().read(Path.of("R_0805.kicad_mod"));
 * fp.getDiagnostics().forEach(System.out::println);
 * KiCadFormat.footprint().write(fp, Path.of("R_0805_copy.kicad_mod"));
 * }</pre>
 *
 * <p>Reading is lenient below the root: a malformed element is dropped and reported as an error
 * {@link Diagnostic}, an unknown one is kept verbatim and reported as a warning. Only syntax errors,
 * a wrong root token, I/O failures and cancellation throw.
 *
 * @param <D> the document type
 */
public interface KiCadFormat<D extends KiCadDocument> {
  static KiCadFormat<SymbolLibrary> symbolLibrary() {
    return symbolLibrary(FormatOptions.defaults());
  }

  static KiCadFormat<SymbolLibrary> symbolLibrary(FormatOptions options) {
    return new KiCadFormatImpl<>(
        DocumentKind.SYMBOL_LIBRARY, new SymbolLibraryReader(), new SymbolLibraryWriter(), options);
  }

  static KiCadFormat<Schematic> schematic() {
    return schematic(FormatOptions.defaults());
  }

  static KiCadFormat<Schematic> schematic(FormatOptions options) {
    return new KiCadFormatImpl<>(
        DocumentKind.SCHEMATIC, new SchematicReader(), new SchematicWriter(), options);
  }

  static KiCadFormat<Footprint> footprint() {
    return footprint(FormatOptions.defaults());
  }

  static KiCadFormat<Footprint> footprint(FormatOptions options) {
    return new KiCadFormatImpl<>(
        DocumentKind.FOOTPRINT, new FootprintReader(), new FootprintWriter(), options);
  }

  static KiCadFormat<Board> board() {
    return board(FormatOptions.defaults());
  }

  static KiCadFormat<Board> board(FormatOptions options) {
    return new KiCadFormatImpl<>(DocumentKind.BOARD, new BoardReader(), new BoardWriter(), options);
  }

  /**
   * Picks the format for a file from its extension.
   *
   * @param path the file
   * @return the matching format with default options
   * @throws KiCadFileException with code {@link KiCadFileException#UNSUPPORTED} if the extension is
   *     not a KiCad one
   */
  static KiCadFormat<? extends KiCadDocument> detect(Path path) throws KiCadFileException {
    Path name = path.getFileName();
    DocumentKind kind =
        DocumentKind.forFileName(name == null ? "" : name.toString())
            .orElseThrow(
                () ->
                    KiCadFileException.unsupported(
                        "Not a KiCad document extension", path.toString()));
    switch (kind) {
      case SYMBOL_LIBRARY:
        return symbolLibrary();
      case SCHEMATIC:
        return schematic();
      case FOOTPRINT:
        return footprint();
      default:
        return board();
    }
  }

  /** @return the kind of document this format reads */
  DocumentKind kind();

  FormatOptions options();

  /**
   * Reads a document from a file.
   *
   * @param path the file
   * @return the document with its diagnostics
   * @throws KiCadFileException on I/O, syntax or root token failure
   */
  D read(Path path) throws KiCadFileException;

  /**
   * Reads a document from a file, polling the token between read chunks.
   *
   * @param path the file
   * @param token the cancellation token
   * @return the document with its diagnostics
   * @throws KiCadFileException on I/O, syntax or root token failure, or when cancelled
   */
  D read(Path path, CancellationToken token) throws KiCadFileException;

  /**
   * Reads a UTF-8 document from a stream. The stream is not closed.
   *
   * @param in the stream
   * @return the document with its diagnostics
   * @throws KiCadFileException on I/O, syntax or root token failure
   */
  D read(InputStream in) throws KiCadFileException;

  D read(InputStream in, CancellationToken token) throws KiCadFileException;

  /**
   * Reads a document from text.
   *
   * @param text the document text
   * @return the document with its diagnostics
   * @throws KiCadFileException on syntax or root token failure
   */
  D parse(CharSequence text) throws KiCadFileException;

  /**
   * Builds a document from an already parsed tree.
   *
   * @param root the root node
   * @return the document with its diagnostics
   * @throws KiCadFileException if the root token does not match this format
   */
  D fromTree(Node root) throws KiCadFileException;

  /**
   * Converts a document back into a tree, reusing the provenance recorded when it was read.
   *
   * @param document the document
   * @return the root node
   */
  Node toTree(D document);

  /**
   * Writes a document as UTF-8 text. The stream is flushed but not closed.
   *
   * @param document the document
   * @param out the stream
   * @throws KiCadFileException on I/O failure
   */
  void write(D document, OutputStream out) throws KiCadFileException;

  void write(D document, OutputStream out, CancellationToken token) throws KiCadFileException;

  /**
   * Writes a document to a file, replacing its content.
   *
   * @param document the document
   * @param path the file
   * @throws KiCadFileException on I/O failure
   */
  void write(D document, Path path) throws KiCadFileException;

  /** @return the document text, ending with a newline */
  String writeToString(D document);
}
